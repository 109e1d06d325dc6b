package com.example.salesBack.dto;

import com.example.salesBack.model.Role;
import jakarta.validation.constraints.NotNull;

public record RoleUpdateRequest(@NotNull(message = "Role is required") Role role) {
}
