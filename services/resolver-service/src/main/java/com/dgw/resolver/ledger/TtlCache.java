package com.dgw.resolver.ledger;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.LongSupplier;

public class TtlCache<V> {
    private final ConcurrentHashMap<String, Entry<V>> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> order = new ConcurrentLinkedQueue<>();
    private final int maxEntries;
    private final long ttlMs;
    private final LongSupplier clock;

    public TtlCache(int maxEntries, long ttlMs) {
        this(maxEntries, ttlMs, System::currentTimeMillis);
    }

    TtlCache(int maxEntries, long ttlMs, LongSupplier clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.ttlMs = Math.max(1L, ttlMs);
        this.clock = clock;
    }

    public Optional<V> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (clock.getAsLong() > entry.expiresAtMs()) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    // false when the key is already taken
    public boolean putIfAbsent(String key, V value) {
        if (key == null || value == null) {
            return false;
        }
        Entry<V> entry = new Entry<>(value, clock.getAsLong() + ttlMs);
        if (entries.putIfAbsent(key, entry) != null) {
            return false;
        }
        order.add(key);
        evictIfNeeded();
        return true;
    }

    public int size() {
        return entries.size();
    }

    private void evictIfNeeded() {
        while (entries.size() > maxEntries) {
            String key = order.poll();
            if (key == null) {
                break;
            }
            entries.remove(key);
        }
    }

    private record Entry<V>(V value, long expiresAtMs) {}
}
