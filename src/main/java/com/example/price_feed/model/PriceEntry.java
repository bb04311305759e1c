package com.example.price_feed.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Current price of one asset in one currency.
 * Serialized with capitalized keys: {@code Symbol}, {@code Amount}, {@code Type}.
 */
public record PriceEntry(
        @JsonProperty("Symbol") String symbol,     // registered asset id, e.g. "bitcoin"
        @JsonProperty("Amount") BigDecimal amount, // always > 0
        @JsonProperty("Type") String type          // currency code, e.g. "USD"
) {}
