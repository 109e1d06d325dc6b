package com.example.salesBack.dto;

import com.example.salesBack.model.Role;
import com.example.salesBack.model.User;

/**
 * Owner details embedded in performance responses.
 */
public record UserSummaryDTO(String id, String firstName, String lastName, String email, Role role) {

    public static UserSummaryDTO from(User user) {
        return new UserSummaryDTO(user.getId(), user.getFirstName(), user.getLastName(), user.getEmail(), user.getRole());
    }
}
