package com.shopnest.authservice.SecurityConfig;

import com.shopnest.authservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends 401 for unauthenticated requests to protected routes, using the reason
 * {@link JwtAuthFilter} recorded (AUTH_REQUIRED when none was).
 */
@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ErrorResponseWriter writer;

    public JwtAuthenticationEntryPoint(ErrorResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void commence(@NonNull HttpServletRequest request,
                         @NonNull HttpServletResponse response,
                         @NonNull AuthenticationException authException) throws IOException {
        AuthFailure failure = request.getAttribute(AuthFailure.REQUEST_ATTRIBUTE) instanceof AuthFailure f
                ? f
                : AuthFailure.AUTH_REQUIRED;

        if (failure == AuthFailure.INVALID_TOKEN || failure == AuthFailure.TOKEN_REVOKED) {
            response.setHeader("WWW-Authenticate", "Bearer error=\"invalid_token\"");
        } else {
            response.setHeader("WWW-Authenticate", "Bearer");
        }
        writer.write(request, response, HttpStatus.UNAUTHORIZED, failure.name(), failure.message());
    }
}
