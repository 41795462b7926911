package com.tinyurl.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value cache used for short code lookups and click counters.
 *
 * <p>Implementations absorb their own backend failures: a broken cache degrades the hit rate,
 * it never fails the caller.
 */
public interface CacheService {

    String CLICKS_KEY_PREFIX = "clicks:";

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Atomically adds one to the click counter of {@code shortCode}.
     *
     * @return the counter value after the increment
     */
    long incrementClicks(String shortCode);

    static String clicksKey(String shortCode) {
        return CLICKS_KEY_PREFIX + shortCode;
    }
}
