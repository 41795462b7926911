package com.tinyurl.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process expiring map backing the secondary cache tier.
 *
 * <p>Expired entries are not evicted in the background. They are dropped when their key is
 * looked up or when {@link #purgeExpired()} sweeps the map.
 */
public class FallbackCache {

    private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public FallbackCache(Clock clock) {
        this.clock = clock;
    }

    public Optional<String> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void put(String key, String value, Duration ttl) {
        entries.put(key, new CacheEntry(value, clock.instant().plus(ttl)));
    }

    public void remove(String key) {
        entries.remove(key);
    }

    /**
     * Adds one to the integer stored under {@code key}.
     *
     * <p>The read-modify-write runs inside {@link ConcurrentMap#compute}, so concurrent callers on
     * the same key are serialized and no update is lost. A missing or expired entry starts from
     * zero with a fresh {@code ttl}; a live entry keeps its expiry. Non-numeric values count as zero.
     */
    public long increment(String key, Duration ttl) {
        CacheEntry updated = entries.compute(key, (k, current) -> {
            Instant now = clock.instant();
            if (current == null || current.isExpired(now)) {
                return new CacheEntry("1", now.plus(ttl));
            }
            return new CacheEntry(Long.toString(parseCount(current.value()) + 1), current.expiresAt());
        });
        return Long.parseLong(updated.value());
    }

    public void purgeExpired() {
        Instant now = clock.instant();
        entries.values().removeIf(entry -> entry.isExpired(now));
    }

    public int size() {
        return entries.size();
    }

    private static long parseCount(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
