package com.tinyurl.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends TinyUrlException {

    public NotFoundException(String message) {
        super(message, HttpStatus.NOT_FOUND, "Resource not found");
    }
}
