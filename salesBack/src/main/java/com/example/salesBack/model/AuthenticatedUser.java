package com.example.salesBack.model;

/**
 * Minimal identity of the caller, attached to the security context for the
 * duration of one request. Carries no role; privileged operations re-read it
 * from the user store.
 */
public record AuthenticatedUser(String id, String email, String firstName, String lastName) {

    public static AuthenticatedUser of(User user) {
        return new AuthenticatedUser(user.getId(), user.getEmail(), user.getFirstName(), user.getLastName());
    }
}
