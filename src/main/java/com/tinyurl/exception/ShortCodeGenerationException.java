package com.tinyurl.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised when no free short code could be found within the allowed number of attempts.
 */
public class ShortCodeGenerationException extends TinyUrlException {

    public ShortCodeGenerationException(String message) {
        super(message, HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }
}
