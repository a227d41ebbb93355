package com.shopnest.authservice.utils;

import com.shopnest.authservice.SecurityConfig.AuthenticatedUser;
import lombok.NonNull;
import org.springframework.data.domain.AuditorAware;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Audit identity for {@code created_by}/{@code modified_by}: "ADMIN:&lt;email&gt;" or
 * "USER:&lt;email&gt;" for token-authenticated calls, "SYSTEM" otherwise
 * (registration, password reset, bootstrap).
 */
@Component("auditorAware")
public class AuditorAwareImpl implements AuditorAware<String> {

    static final String SYSTEM = "SYSTEM";

    @Override
    @NonNull
    public Optional<String> getCurrentAuditor() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated()
                || !(auth.getPrincipal() instanceof AuthenticatedUser principal)) {
            return Optional.of(SYSTEM);
        }
        String prefix = principal.isAdmin() ? "ADMIN" : "USER";
        return Optional.of(prefix + ":" + principal.email());
    }
}
