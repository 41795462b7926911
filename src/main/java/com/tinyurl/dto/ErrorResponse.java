package com.tinyurl.dto;

/**
 * Body returned for every failed request.
 *
 * @param error   the specific failure, e.g. {@code "Short code 'abc' not found"}
 * @param message the caller-facing category, e.g. {@code "Resource not found"}
 * @param code    the HTTP status code
 */
public record ErrorResponse(String error, String message, int code) {
}
