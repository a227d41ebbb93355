package com.shopnest.authservice.SecurityConfig;

import com.shopnest.authservice.exception.ExternalExceptions;
import com.shopnest.authservice.service.SessionRegistry;
import com.shopnest.authservice.utils.ErrorResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Turns a valid, non-revoked bearer token into an {@link AuthenticatedUser}. Never
 * rejects by itself: it records an {@link AuthFailure} and lets the authorization rules
 * decide, so a stale header does not break public routes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilter extends OncePerRequestFilter {

    private final JwtTokenProvider tokenProvider;
    private final SessionRegistry sessionRegistry;
    private final ErrorResponseWriter errorWriter;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        // 1) Extract Bearer token
        Optional<String> extracted = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (extracted.isEmpty()) {
            request.setAttribute(AuthFailure.REQUEST_ATTRIBUTE, AuthFailure.NO_TOKEN);
            filterChain.doFilter(request, response);
            return;
        }
        final String token = extracted.get();

        // 2) Revoked tokens are rejected before any claim is trusted
        try {
            if (sessionRegistry.isBlacklisted(token)) {
                log.debug("Rejected revoked token on {}", request.getRequestURI());
                request.setAttribute(AuthFailure.REQUEST_ATTRIBUTE, AuthFailure.TOKEN_REVOKED);
                filterChain.doFilter(request, response);
                return;
            }
        } catch (ExternalExceptions.UpstreamUnavailable ex) {
            log.error("Blacklist check failed on {}: {}", request.getRequestURI(), ex.getMessage());
            errorWriter.write(request, response, ex.getStatus(), ex.getCode(), ex.getMessage());
            return;
        }

        // 3) Signature, issuer, audience, expiry
        try {
            AccessClaims claims = tokenProvider.verifyAccess(token);
            AuthenticatedUser principal = AuthenticatedUser.from(claims);

            // 4) Populate the context; no user-store lookup
            SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
            UsernamePasswordAuthenticationToken authToken =
                    new UsernamePasswordAuthenticationToken(principal, null, principal.authorities());
            authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            securityContext.setAuthentication(authToken);
            SecurityContextHolder.setContext(securityContext);
        } catch (InvalidTokenException ex) {
            log.debug("JWT validation failed: {}", ex.getMessage());
            request.setAttribute(AuthFailure.REQUEST_ATTRIBUTE, AuthFailure.INVALID_TOKEN);
        }

        // 5) Continue filter chain
        filterChain.doFilter(request, response);
    }
}
