package com.example.salesBack.dto;

import com.example.salesBack.model.AccountStatus;
import com.example.salesBack.model.Role;
import com.example.salesBack.model.User;
import lombok.Getter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Public view of a user. Never carries the password hash or lockout internals
 * beyond the blocked flag.
 */
@Getter
public class UserProfileDTO {
    private final String id;
    private final String firstName;
    private final String lastName;
    private final String fullName;
    private final String initials;
    private final String email;
    private final Role role;
    private final AccountStatus status;
    private final boolean blocked;
    private final String avatar;
    private final String phone;
    private final String jobTitle;
    private final String department;
    private final LocalDate hireDate;
    private final LocalDateTime lastLoginAt;

    private UserProfileDTO(User user) {
        this.id = user.getId();
        this.firstName = user.getFirstName();
        this.lastName = user.getLastName();
        this.fullName = user.getFullName();
        this.initials = user.getInitials();
        this.email = user.getEmail();
        this.role = user.getRole();
        this.status = user.getStatus();
        this.blocked = user.isBlocked();
        this.avatar = user.getAvatar();
        this.phone = user.getPhone();
        this.jobTitle = user.getJobTitle();
        this.department = user.getDepartment();
        this.hireDate = user.getHireDate();
        this.lastLoginAt = user.getLastLoginAt();
    }

    public static UserProfileDTO from(User user) {
        return new UserProfileDTO(user);
    }
}
