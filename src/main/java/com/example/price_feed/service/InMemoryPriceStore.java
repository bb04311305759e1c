package com.example.price_feed.service;

import com.example.price_feed.model.PriceEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Service
public class InMemoryPriceStore implements PriceStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPriceStore.class);

    // Symbol -> currency type -> entry. Sorted so listings come out in a stable order.
    // Guarded by lock.
    private final Map<String, Map<String, PriceEntry>> prices = new TreeMap<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public List<PriceEntry> getAllPrices() {
        lock.readLock().lock();
        try {
            List<PriceEntry> result = new ArrayList<>();
            prices.values().forEach(byType -> result.addAll(byType.values()));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<PriceEntry> getPrice(String symbol, String type) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(prices.getOrDefault(symbol, Map.of()).get(type));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<PriceEntry> setPrice(PriceEntry entry) {
        PriceEntry previous;
        lock.writeLock().lock();
        try {
            previous = prices.computeIfAbsent(entry.symbol(), k -> new TreeMap<>())
                    .put(entry.type(), entry);
        } finally {
            lock.writeLock().unlock();
        }

        if (previous == null) {
            logger.info("Set {} {} price: {}", entry.symbol(), entry.type(), entry.amount());
        } else {
            logger.info("Updated {} {} price: {} (was {})",
                    entry.symbol(), entry.type(), entry.amount(), previous.amount());
        }
        return Optional.ofNullable(previous);
    }
}
