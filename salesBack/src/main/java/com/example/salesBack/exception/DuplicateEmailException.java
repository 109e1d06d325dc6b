package com.example.salesBack.exception;

import org.springframework.http.HttpStatus;

public class DuplicateEmailException extends ApiException {

    public DuplicateEmailException() {
        super(HttpStatus.BAD_REQUEST, "A user with this email already exists");
    }

    public DuplicateEmailException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
