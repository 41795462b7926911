package com.tinyurl.exception;

import org.springframework.http.HttpStatus;

public class AlreadyExistsException extends TinyUrlException {

    public AlreadyExistsException(String message) {
        super(message, HttpStatus.CONFLICT, "Resource already exists");
    }
}
