package com.example.price_feed.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw body of a set-price call. Fields are left unchecked here;
 * amount stays a JsonNode because clients send it either as a number or as a string.
 */
public record SetPriceRequest(
        String symbol,
        JsonNode amount,
        String type
) {}
