package com.example.salesBack.service;

import com.example.salesBack.dto.FieldErrorDTO;
import com.example.salesBack.dto.PerformanceDTO;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Validation stage run before any performance write, for creates and updates alike.
 * Field constraints come from the bean-validation annotations on {@link PerformanceDTO};
 * the cross-field rules live here.
 */
@Component
public class PerformanceValidator {

    private final Validator validator;

    public PerformanceValidator(Validator validator) {
        this.validator = validator;
    }

    public List<FieldErrorDTO> validate(PerformanceDTO dto) {
        List<FieldErrorDTO> errors = new ArrayList<>();
        for (ConstraintViolation<PerformanceDTO> violation : validator.validate(dto)) {
            errors.add(new FieldErrorDTO(violation.getPropertyPath().toString(), violation.getMessage()));
        }
        errors.sort(Comparator.comparing(FieldErrorDTO::field).thenComparing(FieldErrorDTO::message));

        if (dto.getSalesCompleted() != null && dto.getAppointmentsCompleted() != null
                && dto.getSalesCompleted() > dto.getAppointmentsCompleted()) {
            errors.add(new FieldErrorDTO("salesCompleted",
                    "Completed sales cannot exceed completed appointments"));
        }
        if (dto.getFilesUpdated() != null && dto.getTotalFiles() != null
                && dto.getFilesUpdated() > dto.getTotalFiles()) {
            errors.add(new FieldErrorDTO("filesUpdated",
                    "Updated files cannot exceed total files"));
        }
        return errors;
    }
}
