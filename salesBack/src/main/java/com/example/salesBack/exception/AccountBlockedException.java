package com.example.salesBack.exception;

import org.springframework.http.HttpStatus;

public class AccountBlockedException extends ApiException {

    public AccountBlockedException() {
        super(HttpStatus.LOCKED, "Account blocked. Contact your administrator.");
    }

    public AccountBlockedException(String message) {
        super(HttpStatus.LOCKED, message);
    }
}
