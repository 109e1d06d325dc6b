package com.example.salesBack.exception;

import org.springframework.http.HttpStatus;

public class AccountInactiveException extends ApiException {

    public AccountInactiveException() {
        super(HttpStatus.FORBIDDEN, "Account inactive. Contact your administrator.");
    }

    public AccountInactiveException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
