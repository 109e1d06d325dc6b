package com.example.salesBack.config;

import com.example.salesBack.model.AccountStatus;
import com.example.salesBack.model.Role;
import com.example.salesBack.model.User;
import com.example.salesBack.repository.UserRepository;
import com.example.salesBack.service.UserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Creates the default administrator on startup when no account exists for
 * {@code app.admin.email}.
 */
@Component
public class AdminAccountInitializer implements CommandLineRunner {
    private static final Logger logger = LoggerFactory.getLogger(AdminAccountInitializer.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final boolean enabled;
    private final String adminEmail;
    private final String adminPassword;

    public AdminAccountInitializer(UserRepository userRepository,
                                   PasswordEncoder passwordEncoder,
                                   @Value("${app.admin.seed-enabled:true}") boolean enabled,
                                   @Value("${app.admin.email:admin@sales.local}") String adminEmail,
                                   @Value("${app.admin.password:Admin123!}") String adminPassword) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.enabled = enabled;
        this.adminEmail = UserService.normalizeEmail(adminEmail);
        this.adminPassword = adminPassword;
    }

    @Override
    public void run(String... args) {
        if (!enabled) {
            return;
        }
        if (userRepository.existsByEmail(adminEmail)) {
            logger.info("Default admin user already exists");
            return;
        }

        User admin = new User();
        admin.setFirstName("Admin");
        admin.setLastName("System");
        admin.setEmail(adminEmail);
        admin.setPassword(passwordEncoder.encode(adminPassword));
        admin.setRole(Role.ADMIN);
        admin.setStatus(AccountStatus.ACTIVE);
        admin.setHireDate(LocalDate.now());
        userRepository.save(admin);

        logger.info("Default admin user created: {}", adminEmail);
    }
}
