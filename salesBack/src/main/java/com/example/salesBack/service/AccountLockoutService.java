package com.example.salesBack.service;

import com.example.salesBack.exception.ResourceNotFoundException;
import com.example.salesBack.model.User;
import com.example.salesBack.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Lockout state machine: {@code active -> blocked} on the fifth consecutive
 * failed password check, {@code blocked -> active} only through {@link #unlock(String)}.
 * Every transition is a field-level update on the stored user, never a write
 * of a previously loaded copy.
 */
@Service
public class AccountLockoutService {
    public static final int MAX_FAILED_ATTEMPTS = 5;

    private static final Logger logger = LoggerFactory.getLogger(AccountLockoutService.class);

    private final UserRepository userRepository;

    public AccountLockoutService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public User recordFailedAttempt(User user) {
        User updated = userRepository.incrementFailedLoginAttempts(user.getId()).orElse(null);
        if (updated == null) {
            // already blocked, the counter stays frozen
            return user;
        }

        if (updated.getFailedLoginAttempts() >= MAX_FAILED_ATTEMPTS) {
            LocalDateTime now = LocalDateTime.now();
            if (userRepository.block(updated.getId(), now)) {
                logger.warn("Account {} blocked after {} failed login attempts", updated.getId(), updated.getFailedLoginAttempts());
            }
            updated.setBlocked(true);
            if (updated.getBlockedAt() == null) {
                updated.setBlockedAt(now);
            }
        } else {
            logger.info("Failed login attempt {} for account {}", updated.getFailedLoginAttempts(), updated.getId());
        }
        return updated;
    }

    /**
     * Resets the counter and stamps the login time. Never touches the blocked
     * flag or the status; the returned user reflects them as currently stored.
     */
    public User recordSuccessfulLogin(User user) {
        Update update = new Update()
                .set("failedLoginAttempts", 0)
                .set("lastLoginAt", LocalDateTime.now());
        return userRepository.updateFields(user.getId(), update)
                .orElseThrow(() -> new ResourceNotFoundException("User not found"));
    }

    public User unlock(String userId) {
        Update update = new Update()
                .set("blocked", false)
                .set("failedLoginAttempts", 0)
                .unset("blockedAt");
        User user = userRepository.updateFields(userId, update)
                .orElseThrow(() -> new ResourceNotFoundException("User not found"));
        logger.info("Account {} unlocked", userId);
        return user;
    }
}
