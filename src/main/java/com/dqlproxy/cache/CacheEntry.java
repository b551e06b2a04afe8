package com.dqlproxy.cache;

import lombok.Value;

import java.time.Instant;

/**
 * Cached value with the time it was stored. The sequence number orders entries stored
 * within the same clock tick.
 */
@Value
class CacheEntry<V> {

    V value;
    Instant storedAt;
    long sequence;

    boolean isOlderThan(CacheEntry<?> other) {
        int byTime = storedAt.compareTo(other.storedAt);
        return byTime != 0 ? byTime < 0 : sequence < other.sequence;
    }
}
