package com.example.salesBack.exception;

import com.example.salesBack.dto.FieldErrorDTO;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.List;

/**
 * Base class for every failure the API reports to its caller with a specific
 * HTTP status and a message safe to show to the end user.
 */
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final List<FieldErrorDTO> errors;

    protected ApiException(HttpStatus status, String message) {
        this(status, message, Collections.emptyList());
    }

    protected ApiException(HttpStatus status, String message, List<FieldErrorDTO> errors) {
        super(message);
        this.status = status;
        this.errors = errors == null ? Collections.emptyList() : List.copyOf(errors);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public List<FieldErrorDTO> getErrors() {
        return errors;
    }
}
