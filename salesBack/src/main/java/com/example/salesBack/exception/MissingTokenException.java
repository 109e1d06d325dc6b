package com.example.salesBack.exception;

import org.springframework.http.HttpStatus;

public class MissingTokenException extends ApiException {

    public MissingTokenException() {
        super(HttpStatus.UNAUTHORIZED, "Not authorized, token missing");
    }

    public MissingTokenException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }
}
