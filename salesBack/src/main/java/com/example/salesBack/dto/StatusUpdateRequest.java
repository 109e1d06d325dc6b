package com.example.salesBack.dto;

import com.example.salesBack.model.AccountStatus;
import jakarta.validation.constraints.NotNull;

public record StatusUpdateRequest(@NotNull(message = "Status is required") AccountStatus status) {
}
