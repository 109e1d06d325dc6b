package com.example.salesBack.dto;

public class AuthResponse {
    private final String token;
    private final UserProfileDTO user;

    public AuthResponse(String token, UserProfileDTO user) {
        this.token = token;
        this.user = user;
    }

    public String getToken() {
        return token;
    }

    public UserProfileDTO getUser() {
        return user;
    }
}
