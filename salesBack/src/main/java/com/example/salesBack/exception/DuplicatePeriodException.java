package com.example.salesBack.exception;

import org.springframework.http.HttpStatus;

public class DuplicatePeriodException extends ApiException {

    public DuplicatePeriodException() {
        super(HttpStatus.BAD_REQUEST, "Performance data already exists for this period");
    }

    public DuplicatePeriodException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
