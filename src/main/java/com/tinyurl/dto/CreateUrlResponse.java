package com.tinyurl.dto;

public record CreateUrlResponse(String shortUrl, String longUrl, String shortCode) {
}
