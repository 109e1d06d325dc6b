package com.example.salesBack.service;

import com.example.salesBack.dto.AuthResponse;
import com.example.salesBack.dto.RegisterRequest;
import com.example.salesBack.dto.UserProfileDTO;
import com.example.salesBack.exception.AccountBlockedException;
import com.example.salesBack.exception.AccountInactiveException;
import com.example.salesBack.exception.InvalidCredentialsException;
import com.example.salesBack.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.authentication.LockedException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;

/**
 * Registration and login. Login delegates the credential checks to Spring
 * Security's {@link AuthenticationManager}, whose pre-authentication checks
 * reject blocked and inactive accounts before the password is ever compared.
 */
@Service
public class AuthenticationService {
    private static final Logger logger = LoggerFactory.getLogger(AuthenticationService.class);

    private final AuthenticationManager authenticationManager;
    private final UserService userService;
    private final AccountLockoutService accountLockoutService;
    private final JwtUtil jwtUtil;

    public AuthenticationService(AuthenticationManager authenticationManager,
                                 UserService userService,
                                 AccountLockoutService accountLockoutService,
                                 JwtUtil jwtUtil) {
        this.authenticationManager = authenticationManager;
        this.userService = userService;
        this.accountLockoutService = accountLockoutService;
        this.jwtUtil = jwtUtil;
    }

    public AuthResponse register(RegisterRequest request) {
        User user = userService.register(request);
        return new AuthResponse(jwtUtil.generateToken(user.getId()), UserProfileDTO.from(user));
    }

    public AuthResponse login(String email, String password) {
        String normalizedEmail = UserService.normalizeEmail(email);
        Authentication authentication;
        try {
            authentication = authenticationManager.authenticate(
                    new UsernamePasswordAuthenticationToken(normalizedEmail, password));
        } catch (LockedException e) {
            logger.warn("Login refused for blocked account {}", normalizedEmail);
            throw new AccountBlockedException();
        } catch (DisabledException e) {
            logger.warn("Login refused for inactive account {}", normalizedEmail);
            throw new AccountInactiveException();
        } catch (BadCredentialsException e) {
            // Same answer whether the email or the password is wrong
            userService.findByEmail(normalizedEmail).ifPresent(accountLockoutService::recordFailedAttempt);
            throw new InvalidCredentialsException();
        }

        User user = accountLockoutService.recordSuccessfulLogin((User) authentication.getPrincipal());
        // state may have changed while the password was being checked
        if (user.isBlocked()) {
            logger.warn("Login refused for account {} blocked during authentication", user.getId());
            throw new AccountBlockedException();
        }
        if (!user.isActive()) {
            logger.warn("Login refused for account {} deactivated during authentication", user.getId());
            throw new AccountInactiveException();
        }
        logger.info("User {} logged in", user.getId());
        return new AuthResponse(jwtUtil.generateToken(user.getId()), UserProfileDTO.from(user));
    }
}
