package com.shopnest.authservice.bootstrap;

import com.shopnest.authservice.entity.User;
import com.shopnest.authservice.entity.UserRole;
import com.shopnest.authservice.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Seeds the first administrator, since admins cannot self-register. Runs only when
 * {@code app.bootstrap.admin.email} and {@code .password} are set; idempotent.
 */
@Slf4j
@Component
@Order(1)
public class AdminInitializer implements CommandLineRunner {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final String adminEmail;
    private final String adminPassword;

    public AdminInitializer(UserRepository userRepository,
                            PasswordEncoder passwordEncoder,
                            @Value("${app.bootstrap.admin.email:}") String adminEmail,
                            @Value("${app.bootstrap.admin.password:}") String adminPassword) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.adminEmail = adminEmail;
        this.adminPassword = adminPassword;
    }

    @Override
    @Transactional
    public void run(String... args) {
        if (!StringUtils.hasText(adminEmail) || !StringUtils.hasText(adminPassword)) {
            log.debug("No bootstrap admin configured");
            return;
        }
        createAdminIfNotExists(User.normalizeEmail(adminEmail), adminPassword);
    }

    private void createAdminIfNotExists(String email, String password) {
        if (userRepository.existsByEmail(email)) {
            log.info("Bootstrap admin '{}' already present", email);
            return;
        }
        User admin = User.builder()
                .email(email)
                .firstName("Platform")
                .lastName("Admin")
                .role(UserRole.ADMIN)
                .emailVerified(true)
                .build();
        admin.applyPassword(password, passwordEncoder);
        userRepository.save(admin);
        log.info("Bootstrap admin '{}' created", email);
    }
}
