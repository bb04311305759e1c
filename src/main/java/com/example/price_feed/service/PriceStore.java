package com.example.price_feed.service;

import com.example.price_feed.model.PriceEntry;

import java.util.List;
import java.util.Optional;

public interface PriceStore {

    /**
     * Returns a snapshot of every current price, ordered by symbol and then currency type.
     */
    List<PriceEntry> getAllPrices();

    Optional<PriceEntry> getPrice(String symbol, String type);

    /**
     * Stores the entry, replacing any earlier price for the same symbol and currency type.
     *
     * @return the entry that was replaced, if there was one
     */
    Optional<PriceEntry> setPrice(PriceEntry entry);
}
