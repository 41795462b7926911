package com.tinyurl.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Two-tier cache: Redis as the primary tier and a {@link FallbackCache} mirror.
 *
 * <p>Every write lands in the fallback tier whatever happens to the Redis write, so the mirror
 * can serve reads while Redis is down. Redis errors are logged and never rethrown. A {@code null}
 * template means no Redis is configured and the fallback tier is used on its own.
 */
public class TieredCacheService implements CacheService {

    private static final Logger log = LoggerFactory.getLogger(TieredCacheService.class);

    private final StringRedisTemplate redisTemplate;
    private final FallbackCache fallbackCache;
    private final Duration fallbackTtl;

    public TieredCacheService(StringRedisTemplate redisTemplate, FallbackCache fallbackCache, Duration fallbackTtl) {
        this.redisTemplate = redisTemplate;
        this.fallbackCache = fallbackCache;
        this.fallbackTtl = fallbackTtl;
    }

    @Override
    public Optional<String> get(String key) {
        if (redisTemplate != null) {
            try {
                String value = redisTemplate.opsForValue().get(key);
                if (value != null) {
                    return Optional.of(value);
                }
            } catch (RuntimeException e) {
                log.warn("Redis get failed for key {}, using in-memory cache: {}", key, e.getMessage());
            }
        }

        fallbackCache.purgeExpired();
        Optional<String> value = fallbackCache.get(key);
        log.debug("Fallback lookup for key {}: {}", key, value.isPresent() ? "hit" : "miss");
        return value;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (redisTemplate != null) {
            try {
                redisTemplate.opsForValue().set(key, value, ttl);
            } catch (RuntimeException e) {
                log.warn("Redis set failed for key {}, keeping in-memory copy only: {}", key, e.getMessage());
            }
        }
        fallbackCache.put(key, value, ttl);
    }

    @Override
    public void delete(String key) {
        if (redisTemplate != null) {
            try {
                redisTemplate.delete(key);
            } catch (RuntimeException e) {
                log.warn("Redis delete failed for key {}: {}", key, e.getMessage());
            }
        }
        fallbackCache.remove(key);
    }

    @Override
    public long incrementClicks(String shortCode) {
        String clicksKey = CacheService.clicksKey(shortCode);
        if (redisTemplate != null) {
            try {
                Long count = redisTemplate.opsForValue().increment(clicksKey);
                if (count != null) {
                    return count;
                }
            } catch (RuntimeException e) {
                log.warn("Redis increment failed for key {}, counting in memory: {}", clicksKey, e.getMessage());
            }
        }
        return fallbackCache.increment(clicksKey, fallbackTtl);
    }
}
