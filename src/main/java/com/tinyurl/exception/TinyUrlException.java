package com.tinyurl.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for failures the service reports to its callers.
 *
 * <p>Each subclass fixes the HTTP status and the caller-facing category text that
 * {@link com.tinyurl.controller.GlobalExceptionHandler} renders.
 */
public abstract class TinyUrlException extends RuntimeException {

    private final HttpStatus status;
    private final String category;

    protected TinyUrlException(String message, HttpStatus status, String category) {
        super(message);
        this.status = status;
        this.category = category;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCategory() {
        return category;
    }
}
