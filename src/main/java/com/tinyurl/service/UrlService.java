package com.tinyurl.service;

import com.tinyurl.cache.CacheService;
import com.tinyurl.dto.CreateUrlRequest;
import com.tinyurl.dto.CreateUrlResponse;
import com.tinyurl.dto.UrlStatsResponse;
import com.tinyurl.exception.AlreadyExistsException;
import com.tinyurl.exception.NotFoundException;
import com.tinyurl.exception.ShortCodeGenerationException;
import com.tinyurl.generator.ShortCodeGenerator;
import com.tinyurl.model.ShortLink;
import com.tinyurl.repository.ShortLinkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Creates, resolves, reports on and deletes short links.
 *
 * <p>Reads go to the cache first and fall back to the store. Click counting is fire-and-forget:
 * on a cache hit the cache counter is bumped, on a miss the incremented count is written back to
 * the store, both on {@code clickExecutor} without the caller waiting. Two concurrent misses for
 * the same code each write "stored count + 1", so one of the clicks can be lost. That is accepted
 * in exchange for never blocking a redirect on a write.
 */
@Service
public class UrlService {

    static final int MAX_GENERATION_ATTEMPTS = 10;

    private static final Logger log = LoggerFactory.getLogger(UrlService.class);

    private final ShortLinkRepository repository;
    private final CacheService cache;
    private final ShortCodeGenerator generator;
    private final Executor clickExecutor;
    private final Clock clock;
    private final String baseUrl;
    private final int shortCodeLength;
    private final Duration cacheTtl;

    public UrlService(ShortLinkRepository repository,
                      CacheService cache,
                      ShortCodeGenerator generator,
                      @Qualifier("clickExecutor") Executor clickExecutor,
                      Clock clock,
                      @Value("${app.base-url}") String baseUrl,
                      @Value("${app.short-code.length:8}") int shortCodeLength,
                      @Value("${app.cache.ttl:1h}") Duration cacheTtl) {
        this.repository = repository;
        this.cache = cache;
        this.generator = generator;
        this.clickExecutor = clickExecutor;
        this.clock = clock;
        this.baseUrl = baseUrl;
        this.shortCodeLength = shortCodeLength;
        this.cacheTtl = cacheTtl;
    }

    public CreateUrlResponse createShortUrl(CreateUrlRequest request) {
        Optional<ShortLink> existing = repository.findByLongUrl(request.url());
        if (existing.isPresent()) {
            log.debug("Returning existing short code {} for {}", existing.get().shortCode(), request.url());
            return toResponse(existing.get());
        }

        String shortCode = resolveShortCode(request.url(), request.customCode());

        ShortLink saved;
        try {
            saved = repository.create(ShortLink.create(shortCode, request.url(), clock.instant()));
        } catch (DuplicateKeyException e) {
            // another request took the code between the existence check and the insert
            throw new AlreadyExistsException("Short code '" + shortCode + "' already exists");
        }

        cache.set(saved.shortCode(), saved.longUrl(), cacheTtl);
        log.info("Created short code {} for {}", saved.shortCode(), saved.longUrl());
        return toResponse(saved);
    }

    public String getOriginalUrl(String shortCode) {
        Optional<String> cached = cache.get(shortCode);
        if (cached.isPresent()) {
            runInBackground("increment cached clicks for " + shortCode, () -> cache.incrementClicks(shortCode));
            return cached.get();
        }

        ShortLink link = repository.findByShortCode(shortCode)
                .orElseThrow(() -> new NotFoundException("Short code '" + shortCode + "' not found"));

        cache.set(shortCode, link.longUrl(), cacheTtl);

        ShortLink clicked = link.withClickRecorded(clock.instant());
        runInBackground("update click count for " + shortCode, () -> repository.update(clicked));

        return link.longUrl();
    }

    public UrlStatsResponse getUrlStats(String shortCode) {
        ShortLink link = repository.getStats(shortCode)
                .orElseThrow(() -> new NotFoundException("Short code '" + shortCode + "' not found"));

        long clicks = cache.get(CacheService.clicksKey(shortCode))
                .flatMap(UrlService::parseClicks)
                .orElse(link.clickCount());

        return new UrlStatsResponse(link.shortCode(), link.longUrl(), clicks, link.createdAt(), link.updatedAt());
    }

    public boolean deleteUrl(String shortCode) {
        // evict first so a stale URL is never served for a code that is being removed
        cache.delete(shortCode);
        cache.delete(CacheService.clicksKey(shortCode));

        boolean deleted = repository.deleteByShortCode(shortCode);
        if (deleted) {
            log.info("Deleted short code {}", shortCode);
        }
        return deleted;
    }

    private String resolveShortCode(String longUrl, String customCode) {
        if (customCode != null) {
            String code = generator.generateCustom(customCode);
            if (repository.exists(code)) {
                throw new AlreadyExistsException("Custom code '" + customCode + "' already exists");
            }
            return code;
        }

        for (int attempt = 1; attempt <= MAX_GENERATION_ATTEMPTS; attempt++) {
            String code = generator.generate(longUrl, shortCodeLength);
            if (!repository.exists(code)) {
                return code;
            }
            log.debug("Short code {} already taken (attempt {}/{})", code, attempt, MAX_GENERATION_ATTEMPTS);
        }
        throw new ShortCodeGenerationException(
                "Failed to generate unique short code after " + MAX_GENERATION_ATTEMPTS + " attempts");
    }

    private void runInBackground(String description, Runnable task) {
        try {
            clickExecutor.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    log.error("Failed to {}: {}", description, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Could not schedule task to {}: {}", description, e.getMessage());
        }
    }

    private CreateUrlResponse toResponse(ShortLink link) {
        return new CreateUrlResponse(buildShortUrl(link.shortCode()), link.longUrl(), link.shortCode());
    }

    private String buildShortUrl(String shortCode) {
        String base = baseUrl;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/" + shortCode;
    }

    private static Optional<Long> parseClicks(String value) {
        try {
            return Optional.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric cached click count '{}'", value);
            return Optional.empty();
        }
    }
}
