package com.shopnest.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Credential and token failures raised by the auth flows.
 * Messages are deliberately uniform so callers cannot probe which accounts exist.
 */
public final class AuthExceptions {

    private AuthExceptions() {}

    /** 401 Unauthorized – unknown email or wrong password. */
    public static final class InvalidCredentials extends ApiException {
        public InvalidCredentials() {
            super(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid email or password");
        }
    }

    /** 403 Forbidden – credentials are right but the account is deactivated. */
    public static final class AccountDeactivated extends ApiException {
        public AccountDeactivated() {
            super(HttpStatus.FORBIDDEN, "ACCOUNT_DEACTIVATED", "Account is deactivated");
        }
    }

    /** 401 Unauthorized – refresh token is forged, expired, replayed or unknown. */
    public static final class InvalidRefreshToken extends ApiException {
        public InvalidRefreshToken() {
            super(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN", "Invalid or expired refresh token");
        }
    }

    /** 400 Bad Request – reset or verification token is unknown or expired. */
    public static final class InvalidToken extends ApiException {
        public InvalidToken(String message) {
            super(HttpStatus.BAD_REQUEST, "INVALID_TOKEN", message);
        }
    }

    /** 401 Unauthorized – current password did not match on change-password. */
    public static final class InvalidPassword extends ApiException {
        public InvalidPassword() {
            super(HttpStatus.UNAUTHORIZED, "INVALID_PASSWORD", "Current password is incorrect");
        }
    }
}
