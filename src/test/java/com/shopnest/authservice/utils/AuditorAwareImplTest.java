package com.shopnest.authservice.utils;

import com.shopnest.authservice.SecurityConfig.AuthenticatedUser;
import com.shopnest.authservice.entity.UserRole;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class AuditorAwareImplTest {

    private final AuditorAwareImpl auditorAware = new AuditorAwareImpl();

    @AfterEach
    void clear() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void anonymousIsSystem() {
        assertThat(auditorAware.getCurrentAuditor()).contains("SYSTEM");
    }

    @Test
    void adminIsPrefixed() {
        authenticate(new AuthenticatedUser(UUID.randomUUID().toString(), "root@example.com", UserRole.ADMIN));

        assertThat(auditorAware.getCurrentAuditor()).contains("ADMIN:root@example.com");
    }

    @Test
    void customerIsUser() {
        authenticate(new AuthenticatedUser(UUID.randomUUID().toString(), "alice@example.com", UserRole.CUSTOMER));

        assertThat(auditorAware.getCurrentAuditor()).contains("USER:alice@example.com");
    }

    private static void authenticate(AuthenticatedUser principal) {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(principal, null, principal.authorities()));
    }
}
