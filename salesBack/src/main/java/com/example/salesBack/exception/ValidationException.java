package com.example.salesBack.exception;

import com.example.salesBack.dto.FieldErrorDTO;
import org.springframework.http.HttpStatus;

import java.util.List;

public class ValidationException extends ApiException {

    public ValidationException(List<FieldErrorDTO> errors) {
        super(HttpStatus.BAD_REQUEST, "Invalid data", errors);
    }

    public ValidationException(String field, String message) {
        this(List.of(new FieldErrorDTO(field, message)));
    }
}
