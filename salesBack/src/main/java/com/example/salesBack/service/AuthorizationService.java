package com.example.salesBack.service;

import com.example.salesBack.exception.AccountBlockedException;
import com.example.salesBack.exception.AccountInactiveException;
import com.example.salesBack.exception.ForbiddenException;
import com.example.salesBack.exception.MissingTokenException;
import com.example.salesBack.exception.UserNotFoundException;
import com.example.salesBack.model.AuthenticatedUser;
import com.example.salesBack.model.Role;
import com.example.salesBack.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Authorization gate. Every check re-reads the user, so deactivation, lockout
 * and role changes take effect on the next request without reissuing tokens.
 */
@Service
public class AuthorizationService {
    private static final Logger logger = LoggerFactory.getLogger(AuthorizationService.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtUtil jwtUtil;
    private final UserService userService;

    public AuthorizationService(JwtUtil jwtUtil, UserService userService) {
        this.jwtUtil = jwtUtil;
        this.userService = userService;
    }

    /**
     * Resolves the caller from an {@code Authorization} header. Failures are
     * reported in a fixed order: missing token, invalid or expired token,
     * unknown user, inactive account, blocked account.
     */
    public AuthenticatedUser authenticate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new MissingTokenException();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new MissingTokenException();
        }

        String userId = jwtUtil.verify(token);
        User user = userService.findById(userId).orElseThrow(UserNotFoundException::new);

        if (!user.isActive()) {
            logger.debug("Token of inactive user {} rejected", userId);
            throw new AccountInactiveException("Account inactive");
        }
        if (user.isBlocked()) {
            logger.debug("Token of blocked user {} rejected", userId);
            throw new AccountBlockedException("Account blocked");
        }
        return AuthenticatedUser.of(user);
    }

    public void requireRole(AuthenticatedUser identity, Role... allowedRoles) {
        if (!roleAllowed(identity, Arrays.asList(allowedRoles))) {
            logger.warn("User {} denied, required one of {}", identity.id(), Arrays.toString(allowedRoles));
            throw new ForbiddenException("Access denied: insufficient role");
        }
    }

    /**
     * Boolean form of {@link #requireRole} for {@code @PreAuthorize} expressions,
     * e.g. {@code @authorizationService.hasAnyRole(principal, 'admin')}.
     */
    public boolean hasAnyRole(Object principal, String... roles) {
        if (!(principal instanceof AuthenticatedUser)) {
            return false;
        }
        List<Role> allowed = Arrays.stream(roles).map(Role::fromValue).toList();
        return roleAllowed((AuthenticatedUser) principal, allowed);
    }

    private boolean roleAllowed(AuthenticatedUser identity, List<Role> allowed) {
        return userService.findById(identity.id())
                .map(User::getRole)
                .filter(allowed::contains)
                .isPresent();
    }
}
