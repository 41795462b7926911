package com.tinyurl.repository;

import com.tinyurl.model.ShortLink;

import java.util.Optional;

/**
 * Durable store of short links. Short code uniqueness is enforced here, not by callers.
 */
public interface ShortLinkRepository {

    /** Inserts the link and returns it with its assigned id. */
    ShortLink create(ShortLink link);

    Optional<ShortLink> findByShortCode(String shortCode);

    /** Returns the most recently created link for {@code longUrl}, if any. */
    Optional<ShortLink> findByLongUrl(String longUrl);

    /** Writes long URL, click count and update time of the link identified by its short code. */
    ShortLink update(ShortLink link);

    /** @return whether a row was removed */
    boolean deleteByShortCode(String shortCode);

    Optional<ShortLink> getStats(String shortCode);

    boolean exists(String shortCode);
}
