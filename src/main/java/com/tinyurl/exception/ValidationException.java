package com.tinyurl.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends TinyUrlException {

    public ValidationException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "Validation failed");
    }
}
