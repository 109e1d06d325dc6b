package com.example.salesBack.controller;

import com.example.salesBack.dto.ApiResponse;
import com.example.salesBack.dto.RoleUpdateRequest;
import com.example.salesBack.dto.StatusUpdateRequest;
import com.example.salesBack.dto.UserProfileDTO;
import com.example.salesBack.exception.ValidationException;
import com.example.salesBack.model.AuthenticatedUser;
import com.example.salesBack.model.Role;
import com.example.salesBack.service.AccountLockoutService;
import com.example.salesBack.service.UserService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/admin")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    private final UserService userService;
    private final AccountLockoutService accountLockoutService;

    public AdminController(UserService userService, AccountLockoutService accountLockoutService) {
        this.userService = userService;
        this.accountLockoutService = accountLockoutService;
    }

    /**
     * All users, optionally filtered by role, for the manage users screen
     */
    @GetMapping("/users")
    @PreAuthorize("@authorizationService.hasAnyRole(principal, 'admin', 'manager')")
    public ResponseEntity<ApiResponse<List<UserProfileDTO>>> getUsers(@RequestParam(required = false) String role) {
        List<UserProfileDTO> users = userService.findAll(parseRole(role)).stream()
                .map(UserProfileDTO::from)
                .toList();
        logger.info("Found {} users", users.size());
        return ResponseEntity.ok(ApiResponse.ok(users));
    }

    /**
     * Lifts a lockout: clears the blocked flag, the failure counter and blockedAt
     */
    @PutMapping("/users/{id}/unlock")
    @PreAuthorize("@authorizationService.hasAnyRole(principal, 'admin')")
    public ResponseEntity<ApiResponse<UserProfileDTO>> unlock(@AuthenticationPrincipal AuthenticatedUser caller,
                                                              @PathVariable String id) {
        logger.info("Admin {} unlocking account {}", caller.id(), id);
        UserProfileDTO user = UserProfileDTO.from(accountLockoutService.unlock(id));
        return ResponseEntity.ok(ApiResponse.ok("Account unlocked successfully", user));
    }

    @PutMapping("/users/{id}/status")
    @PreAuthorize("@authorizationService.hasAnyRole(principal, 'admin')")
    public ResponseEntity<ApiResponse<UserProfileDTO>> updateStatus(@PathVariable String id,
                                                                    @Valid @RequestBody StatusUpdateRequest request) {
        UserProfileDTO user = UserProfileDTO.from(userService.updateStatus(id, request.status()));
        return ResponseEntity.ok(ApiResponse.ok("Status updated successfully", user));
    }

    @PutMapping("/users/{id}/role")
    @PreAuthorize("@authorizationService.hasAnyRole(principal, 'admin')")
    public ResponseEntity<ApiResponse<UserProfileDTO>> updateRole(@PathVariable String id,
                                                                  @Valid @RequestBody RoleUpdateRequest request) {
        UserProfileDTO user = UserProfileDTO.from(userService.updateRole(id, request.role()));
        return ResponseEntity.ok(ApiResponse.ok("Role updated successfully", user));
    }

    private static Role parseRole(String role) {
        if (role == null || role.isBlank()) {
            return null;
        }
        try {
            return Role.fromValue(role.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("role", e.getMessage());
        }
    }
}
