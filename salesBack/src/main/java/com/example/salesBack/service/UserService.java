package com.example.salesBack.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import com.example.salesBack.dto.ProfileUpdateRequest;
import com.example.salesBack.dto.RegisterRequest;
import com.example.salesBack.exception.DuplicateEmailException;
import com.example.salesBack.exception.ResourceNotFoundException;
import com.example.salesBack.exception.ValidationException;
import com.example.salesBack.exception.WrongCurrentPasswordException;
import com.example.salesBack.model.AccountStatus;
import com.example.salesBack.model.Role;
import com.example.salesBack.model.User;
import com.example.salesBack.repository.UserRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Credential store: registration, lookups, password checks and profile changes.
 */
@Service
public class UserService {
    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^\\w+([.-]?\\w+)*@\\w+([.-]?\\w+)*(\\.\\w{2,3})+$");

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    public UserService(UserRepository userRepository, PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public User register(RegisterRequest request) {
        String email = normalizeEmail(request.getEmail());
        if (email == null || email.isEmpty()) {
            throw new ValidationException("email", "Email is required");
        }
        if (!EMAIL_PATTERN.matcher(email).matches()) {
            throw new ValidationException("email", "Please enter a valid email");
        }
        if (userRepository.existsByEmail(email)) {
            throw new DuplicateEmailException();
        }

        User user = new User();
        user.setFirstName(request.getFirstName().trim());
        user.setLastName(request.getLastName().trim());
        user.setEmail(email);
        user.setPassword(passwordEncoder.encode(request.getPassword())); // Hash password
        user.setPhone(trimToNull(request.getPhone()));
        user.setJobTitle(trimToNull(request.getJobTitle()));
        user.setDepartment(trimToNull(request.getDepartment()));
        user.setHireDate(LocalDate.now());
        user.setRole(Role.USER);
        user.setStatus(AccountStatus.ACTIVE);

        User saved;
        try {
            saved = userRepository.save(user);
        } catch (DuplicateKeyException e) {
            // lost a race against a concurrent registration for the same email
            throw new DuplicateEmailException();
        }
        logger.info("New user registered: id={}, email={}", saved.getId(), saved.getEmail());
        return saved;
    }

    public Optional<User> findByEmail(String email) {
        return userRepository.findByEmail(normalizeEmail(email));
    }

    public Optional<User> findById(String id) {
        return userRepository.findById(id);
    }

    public User getById(String id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("User not found"));
    }

    public List<User> findAllById(Collection<String> ids) {
        return userRepository.findAllById(ids);
    }

    public List<User> findAll(Role role) {
        return role == null ? userRepository.findAll() : userRepository.findByRole(role);
    }

    public boolean verifyPassword(User user, String candidate) {
        return candidate != null && user.getPassword() != null
                && passwordEncoder.matches(candidate, user.getPassword());
    }

    public User updateProfile(String id, ProfileUpdateRequest request) {
        Update update = new Update();
        setIfText(update, "firstName", request.getFirstName());
        setIfText(update, "lastName", request.getLastName());
        setIfText(update, "phone", request.getPhone());
        setIfText(update, "jobTitle", request.getJobTitle());
        setIfText(update, "department", request.getDepartment());

        if (update.getUpdateObject().isEmpty()) {
            return getById(id);
        }
        User user = applyUpdate(id, update);
        logger.info("Profile updated for user {}", id);
        return user;
    }

    public void changePassword(String id, String currentPassword, String newPassword) {
        User user = getById(id);
        if (!verifyPassword(user, currentPassword)) {
            logger.warn("Password change rejected for user {}: wrong current password", id);
            throw new WrongCurrentPasswordException();
        }
        applyUpdate(id, new Update().set("password", passwordEncoder.encode(newPassword)));
        logger.info("Password changed for user {}", id);
    }

    public User updateStatus(String id, AccountStatus status) {
        User user = applyUpdate(id, new Update().set("status", status));
        logger.info("Status of user {} set to {}", id, status);
        return user;
    }

    public User updateRole(String id, Role role) {
        User user = applyUpdate(id, new Update().set("role", role));
        logger.info("Role of user {} set to {}", id, role);
        return user;
    }

    private User applyUpdate(String id, Update update) {
        return userRepository.updateFields(id, update)
                .orElseThrow(() -> new ResourceNotFoundException("User not found"));
    }

    private static void setIfText(Update update, String field, String value) {
        if (hasText(value)) {
            update.set(field, value.trim());
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String trimToNull(String value) {
        return hasText(value) ? value.trim() : null;
    }
}
