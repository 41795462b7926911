package com.tinyurl.dto;

import java.time.Instant;

// Record to hold the stats data for the response
public record UrlStatsResponse(String shortCode, String longUrl, long clicks, Instant createdAt, Instant updatedAt) {
}
