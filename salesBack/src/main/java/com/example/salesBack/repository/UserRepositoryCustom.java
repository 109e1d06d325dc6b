package com.example.salesBack.repository;

import com.example.salesBack.model.User;
import org.springframework.data.mongodb.core.query.Update;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Field-level writes to a user document. Each call touches only the fields it
 * names, so concurrent changes to other fields of the same user survive.
 */
public interface UserRepositoryCustom {

    /**
     * Adds one to the failure counter of a user that is not blocked.
     *
     * @return the user as stored after the increment, or empty when the user is
     *         blocked or does not exist
     */
    Optional<User> incrementFailedLoginAttempts(String userId);

    /**
     * Sets the blocked flag and its timestamp, unless the user is already blocked.
     *
     * @return true if this call performed the transition
     */
    boolean block(String userId, LocalDateTime blockedAt);

    /** Applies {@code update} and returns the user as stored afterwards. */
    Optional<User> updateFields(String userId, Update update);
}
