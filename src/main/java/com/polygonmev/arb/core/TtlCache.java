package com.polygonmev.arb.core;

import com.polygonmev.arb.domain.CacheEntry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-through TTL cache. Expired entries read as absent and are removed on that
 * read; {@link #evictExpired()} sweeps the rest.
 */
public class TtlCache<K, V> {

    private final ConcurrentHashMap<K, CacheEntry<K, V>> cache = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration defaultTtl;
    private final int maxEntries;

    public TtlCache(Clock clock, Duration defaultTtl, int maxEntries) {
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.maxEntries = maxEntries;
    }

    public void put(K key, V value) {
        put(key, value, defaultTtl);
    }

    public void put(K key, V value, Duration ttl) {
        cache.put(key, new CacheEntry<>(key, value, clock.instant(), ttl));
        if (cache.size() > maxEntries) {
            evictOldest();
        }
    }

    public Optional<V> get(K key) {
        CacheEntry<K, V> entry = cache.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            cache.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public boolean contains(K key) {
        return get(key).isPresent();
    }

    public void delete(K key) {
        cache.remove(key);
    }

    /**
     * Live entries only, oldest first; drops whatever has expired on the way.
     */
    public Map<K, V> snapshot() {
        Instant now = clock.instant();
        Map<K, V> live = new LinkedHashMap<>();
        cache.values().stream()
                .sorted(Comparator.comparing(CacheEntry::storedAt))
                .forEach(entry -> {
                    if (entry.isExpired(now)) {
                        cache.remove(entry.key(), entry);
                    } else {
                        live.put(entry.key(), entry.value());
                    }
                });
        return live;
    }

    public int evictExpired() {
        Instant now = clock.instant();
        int before = cache.size();
        cache.values().removeIf(entry -> entry.isExpired(now));
        return before - cache.size();
    }

    public void clear() {
        cache.clear();
    }

    public int size() {
        return cache.size();
    }

    public Stats stats() {
        Instant now = clock.instant();
        long expired = cache.values().stream().filter(e -> e.isExpired(now)).count();
        return new Stats(cache.size(), cache.size() - expired, expired);
    }

    private void evictOldest() {
        cache.values().stream()
                .min(Comparator.comparing(CacheEntry::storedAt))
                .ifPresent(oldest -> cache.remove(oldest.key(), oldest));
    }

    public record Stats(long totalEntries, long validEntries, long expiredEntries) {
    }
}
