package com.tinyurl.cache;

import java.time.Instant;

record CacheEntry(String value, Instant expiresAt) {

    boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
