package com.example.salesBack.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import lombok.Getter;
import lombok.Setter;

@SuppressWarnings("serial")
@Getter
@Setter
@Document(collection = "users")
public class User implements UserDetails {
    @Id
    private String id;
    private String firstName;
    private String lastName;

    @Indexed(unique = true)
    private String email; // always stored lower-cased

    @JsonIgnore
    private String password; // bcrypt hash

    @Indexed
    private AccountStatus status = AccountStatus.ACTIVE;
    private Role role = Role.USER;

    private String avatar;
    private String phone;
    private String jobTitle;
    private String department;
    private LocalDate hireDate;
    private LocalDateTime lastLoginAt;

    // Lockout state
    private int failedLoginAttempts = 0;
    private boolean blocked = false;
    private LocalDateTime blockedAt;

    // Reserved, no flow issues or consumes these yet
    @JsonIgnore
    private String passwordResetToken;
    @JsonIgnore
    private LocalDateTime passwordResetExpiresAt;

    @CreatedDate
    private LocalDateTime createdAt;
    @LastModifiedDate
    private LocalDateTime updatedAt;

    @JsonIgnore
    public String getFullName() {
        return firstName + " " + lastName;
    }

    @JsonIgnore
    public String getInitials() {
        String first = firstName == null || firstName.isEmpty() ? "" : firstName.substring(0, 1);
        String last = lastName == null || lastName.isEmpty() ? "" : lastName.substring(0, 1);
        return (first + last).toUpperCase();
    }

    @JsonIgnore
    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return Collections.singletonList(new SimpleGrantedAuthority(role.getAuthority()));
    }

    @Override
    @JsonIgnore
    public String getUsername() {
        return email;
    }

    @Override
    public boolean isAccountNonExpired() {
        return true;
    }

    @Override
    public boolean isAccountNonLocked() {
        return !blocked;
    }

    @Override
    public boolean isCredentialsNonExpired() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return isActive();
    }
}
