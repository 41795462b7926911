package com.tinyurl.model;

import java.time.Instant;

/**
 * A persisted short code to long URL mapping.
 *
 * <p>Instances are immutable; click recording produces a new copy that the caller writes back
 * through {@link com.tinyurl.repository.ShortLinkRepository#update(ShortLink)}.
 */
public record ShortLink(Long id,
                        String shortCode,
                        String longUrl,
                        long clickCount,
                        Instant createdAt,
                        Instant updatedAt) {

    // Unsaved link, the repository assigns the id on insert
    public static ShortLink create(String shortCode, String longUrl, Instant now) {
        return new ShortLink(null, shortCode, longUrl, 0L, now, now);
    }

    public ShortLink withId(Long newId) {
        return new ShortLink(newId, shortCode, longUrl, clickCount, createdAt, updatedAt);
    }

    public ShortLink withClickRecorded(Instant now) {
        return new ShortLink(id, shortCode, longUrl, clickCount + 1, createdAt, now);
    }
}
