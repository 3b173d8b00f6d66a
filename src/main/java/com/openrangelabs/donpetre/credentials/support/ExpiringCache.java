package com.openrangelabs.donpetre.credentials.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded key/value cache whose entries expire a fixed time after insertion.
 *
 * <p>Entries are kept in insertion order. When an insert pushes the size above
 * {@code capacity}, the oldest entries are evicted until the size is 80% of capacity.
 * Eviction is by insertion age, not by access.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class ExpiringCache<K, V> {

    private static final double EVICTION_TARGET = 0.8;

    private final Map<K, Entry<V>> entries = new LinkedHashMap<>();
    private final Duration ttl;
    private final int capacity;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ExpiringCache(Duration ttl, int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive");
        }
        this.ttl = ttl;
        this.capacity = capacity;
        this.clock = clock;
    }

    public synchronized Optional<V> get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(key);
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.value);
    }

    public synchronized void put(K key, V value) {
        // re-inserting moves the key to the young end
        entries.remove(key);
        entries.put(key, new Entry<>(value, clock.instant()));
        if (entries.size() > capacity) {
            evictOldest();
        }
    }

    public synchronized void invalidate(K key) {
        entries.remove(key);
    }

    public synchronized void clear() {
        entries.clear();
    }

    /**
     * Drops every expired entry.
     *
     * @return number of entries removed
     */
    public synchronized int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Entry<V>> it = entries.values().iterator();
        while (it.hasNext()) {
            if (isExpired(it.next(), now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public Duration ttl() {
        return ttl;
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    private void evictOldest() {
        int target = (int) Math.floor(capacity * EVICTION_TARGET);
        Iterator<K> it = entries.keySet().iterator();
        while (entries.size() > target && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    private boolean isExpired(Entry<V> entry, Instant now) {
        return !now.isBefore(entry.storedAt.plus(ttl));
    }

    private static final class Entry<V> {
        private final V value;
        private final Instant storedAt;

        private Entry(V value, Instant storedAt) {
            this.value = value;
            this.storedAt = storedAt;
        }
    }
}
