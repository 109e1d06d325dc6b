package com.example.salesBack.controller;

import com.example.salesBack.dto.ApiResponse;
import com.example.salesBack.dto.AuthRequest;
import com.example.salesBack.dto.AuthResponse;
import com.example.salesBack.dto.ChangePasswordRequest;
import com.example.salesBack.dto.ProfileUpdateRequest;
import com.example.salesBack.dto.RegisterRequest;
import com.example.salesBack.dto.UserProfileDTO;
import com.example.salesBack.model.AuthenticatedUser;
import com.example.salesBack.service.AuthenticationService;
import com.example.salesBack.service.UserService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/auth")
public class AuthenticationController {
    private static final Logger logger = LoggerFactory.getLogger(AuthenticationController.class);

    private final AuthenticationService authenticationService;
    private final UserService userService;

    public AuthenticationController(AuthenticationService authenticationService, UserService userService) {
        this.authenticationService = authenticationService;
        this.userService = userService;
    }

    @PostMapping("/register")
    public ResponseEntity<ApiResponse<AuthResponse>> register(@Valid @RequestBody RegisterRequest request) {
        AuthResponse response = authenticationService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok("User created successfully", response));
    }

    @PostMapping("/login")
    public ResponseEntity<ApiResponse<AuthResponse>> login(@Valid @RequestBody AuthRequest request) {
        AuthResponse response = authenticationService.login(request.getEmail(), request.getPassword());
        return ResponseEntity.ok(ApiResponse.ok("Login successful", response));
    }

    @GetMapping("/me")
    public ResponseEntity<ApiResponse<UserProfileDTO>> me(@AuthenticationPrincipal AuthenticatedUser caller) {
        return ResponseEntity.ok(ApiResponse.ok(UserProfileDTO.from(userService.getById(caller.id()))));
    }

    @PutMapping("/profile")
    public ResponseEntity<ApiResponse<UserProfileDTO>> updateProfile(@AuthenticationPrincipal AuthenticatedUser caller,
                                                                     @Valid @RequestBody ProfileUpdateRequest request) {
        UserProfileDTO profile = UserProfileDTO.from(userService.updateProfile(caller.id(), request));
        return ResponseEntity.ok(ApiResponse.ok("Profile updated successfully", profile));
    }

    @PutMapping("/change-password")
    public ResponseEntity<ApiResponse<Void>> changePassword(@AuthenticationPrincipal AuthenticatedUser caller,
                                                            @Valid @RequestBody ChangePasswordRequest request) {
        userService.changePassword(caller.id(), request.getCurrentPassword(), request.getNewPassword());
        return ResponseEntity.ok(ApiResponse.message("Password changed successfully"));
    }

    // Tokens are stateless, the client simply discards its copy
    @PostMapping("/logout")
    public ResponseEntity<ApiResponse<Void>> logout(@AuthenticationPrincipal AuthenticatedUser caller) {
        logger.info("User {} logged out", caller.id());
        return ResponseEntity.ok(ApiResponse.message("Logout successful"));
    }
}
