package com.tinyurl.cache;

import com.tinyurl.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackCacheTest {

    private MutableClock clock;
    private FallbackCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        cache = new FallbackCache(clock);
    }

    @Test
    void get_beforeTtlElapses_shouldReturnValue() {
        cache.put("abc", "https://example.com", Duration.ofSeconds(1));

        assertThat(cache.get("abc")).contains("https://example.com");
    }

    @Test
    void get_afterTtlElapses_shouldReturnEmptyAndEvictEntry() {
        cache.put("abc", "https://example.com", Duration.ofSeconds(1));

        clock.advance(Duration.ofMillis(1001));

        assertThat(cache.get("abc")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void purgeExpired_shouldRemoveOnlyExpiredEntries() {
        cache.put("short", "a", Duration.ofSeconds(1));
        cache.put("long", "b", Duration.ofMinutes(5));

        clock.advance(Duration.ofSeconds(2));
        cache.purgeExpired();

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("long")).contains("b");
    }

    @Test
    void increment_whenKeyMissing_shouldStartAtOne() {
        assertThat(cache.increment("clicks:abc", Duration.ofHours(1))).isEqualTo(1L);
        assertThat(cache.increment("clicks:abc", Duration.ofHours(1))).isEqualTo(2L);
        assertThat(cache.get("clicks:abc")).contains("2");
    }

    @Test
    void increment_whenValueIsNotNumeric_shouldTreatItAsZero() {
        cache.put("clicks:abc", "garbage", Duration.ofHours(1));

        assertThat(cache.increment("clicks:abc", Duration.ofHours(1))).isEqualTo(1L);
    }

    @Test
    void increment_shouldKeepExpiryOfLiveEntry() {
        cache.put("clicks:abc", "5", Duration.ofSeconds(10));

        cache.increment("clicks:abc", Duration.ofHours(1));
        clock.advance(Duration.ofSeconds(11));

        assertThat(cache.get("clicks:abc")).isEmpty();
    }

    @Test
    void increment_whenEntryExpired_shouldRestartCounter() {
        cache.put("clicks:abc", "5", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        assertThat(cache.increment("clicks:abc", Duration.ofHours(1))).isEqualTo(1L);
    }

    @Test
    void increment_fromManyThreads_shouldNotLoseUpdates() throws Exception {
        int threads = 8;
        int incrementsPerThread = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < incrementsPerThread; i++) {
                        cache.increment("clicks:hot", Duration.ofHours(1));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(cache.get("clicks:hot")).contains(String.valueOf(threads * incrementsPerThread));
    }
}
