package com.dqlproxy.cache;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-memory cache where the time-to-live is chosen by each reader.
 *
 * An entry remembers only when it was stored. A read passes its own TTL and treats older
 * entries as absent, removing them on the way. When a store pushes the size past capacity,
 * the single entry with the oldest store time is evicted, regardless of any TTL.
 *
 * All operations are atomic with respect to each other. Hits, misses, expirations and
 * evictions are counted as Micrometer meters under {@code dql.proxy.cache.*}.
 *
 * @param <V> cached value type
 */
@Slf4j
public class TtlCache<V> {

    private final int capacity;
    private final Clock clock;
    private final Map<String, CacheEntry<V>> store = new HashMap<>();

    private long sequence;
    private final Counter hits;
    private final Counter misses;
    private final Counter expirations;
    private final Counter evictions;

    public TtlCache(int capacity, Clock clock) {
        this(capacity, clock, new SimpleMeterRegistry());
    }

    public TtlCache(int capacity, Clock clock, MeterRegistry registry) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;

        this.hits = Counter.builder("dql.proxy.cache.hits")
                .description("Cache reads served from cache")
                .register(registry);
        this.misses = Counter.builder("dql.proxy.cache.misses")
                .description("Cache reads that ran a query")
                .register(registry);
        this.expirations = Counter.builder("dql.proxy.cache.expirations")
                .description("Entries dropped for exceeding the read TTL")
                .register(registry);
        this.evictions = Counter.builder("dql.proxy.cache.evictions")
                .description("Entries evicted for capacity")
                .register(registry);
        Gauge.builder("dql.proxy.cache.entries", this, TtlCache::size)
                .description("Entries in the response cache")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Get a value stored no longer than {@code ttl} ago.
     *
     * @param key fingerprint
     * @param ttl maximum age accepted by this read
     * @return the value, or empty when absent or too old (too old entries are removed)
     */
    public synchronized Optional<V> get(String key, Duration ttl) {
        CacheEntry<V> entry = store.get(key);
        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }
        Duration age = Duration.between(entry.getStoredAt(), clock.instant());
        if (age.compareTo(ttl) > 0) {
            store.remove(key);
            expirations.increment();
            misses.increment();
            log.debug("Cache entry expired: key={}, age={}ms, ttl={}ms", key, age.toMillis(), ttl.toMillis());
            return Optional.empty();
        }
        hits.increment();
        return Optional.of(entry.getValue());
    }

    /**
     * Store a value, replacing and re-timestamping any previous entry for the key.
     */
    public synchronized void put(String key, V value) {
        store.put(key, new CacheEntry<>(value, clock.instant(), ++sequence));
        evictIfNeeded();
    }

    private void evictIfNeeded() {
        if (store.size() <= capacity) {
            return;
        }
        String oldestKey = null;
        CacheEntry<V> oldest = null;
        for (Map.Entry<String, CacheEntry<V>> candidate : store.entrySet()) {
            if (oldest == null || candidate.getValue().isOlderThan(oldest)) {
                oldestKey = candidate.getKey();
                oldest = candidate.getValue();
            }
        }
        store.remove(oldestKey);
        evictions.increment();
        log.debug("Cache full ({} items), evicted oldest key={}", capacity, oldestKey);
    }

    public synchronized void clear() {
        store.clear();
    }

    public synchronized int size() {
        return store.size();
    }

    public synchronized boolean containsKey(String key) {
        return store.containsKey(key);
    }

    public int getCapacity() {
        return capacity;
    }

    public CacheStats getStats() {
        return new CacheStats(size(), capacity,
                (long) hits.count(), (long) misses.count(),
                (long) expirations.count(), (long) evictions.count());
    }

    /**
     * Point-in-time cache counters.
     */
    @lombok.Value
    public static class CacheStats {
        int size;
        int capacity;
        long hits;
        long misses;
        long expirations;
        long evictions;
    }
}
