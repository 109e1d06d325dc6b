package com.example.salesBack.exception;

import org.springframework.http.HttpStatus;

public class UserNotFoundException extends ApiException {

    public UserNotFoundException() {
        super(HttpStatus.UNAUTHORIZED, "Invalid token, user not found");
    }

    public UserNotFoundException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }
}
