package com.example.salesBack.exception;

import org.springframework.http.HttpStatus;

public class WrongCurrentPasswordException extends ApiException {

    public WrongCurrentPasswordException() {
        super(HttpStatus.BAD_REQUEST, "Current password is incorrect");
    }

    public WrongCurrentPasswordException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
