package com.example.salesBack.dto;

import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

/**
 * Partial profile update. Null or blank fields are left untouched.
 */
@Getter
@Setter
public class ProfileUpdateRequest {
    @Size(min = 2, max = 50, message = "First name must be between 2 and 50 characters")
    private String firstName;

    @Size(min = 2, max = 50, message = "Last name must be between 2 and 50 characters")
    private String lastName;

    @Size(max = 30)
    private String phone;

    @Size(max = 100)
    private String jobTitle;

    @Size(max = 100)
    private String department;
}
