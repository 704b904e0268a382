package com.polygonmev.arb.domain;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry<K, V>(K key, V value, Instant storedAt, Duration ttl) {

    public boolean isExpired(Instant now) {
        return now.isAfter(storedAt.plus(ttl));
    }
}
