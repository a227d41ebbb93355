package com.shopnest.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * User-domain exceptions (registration, profile and admin lifecycle).
 */
public final class UserExceptions {

    private UserExceptions() {}

    /** 404 Not Found – User record not present. */
    public static final class UserNotFound extends ApiException {
        public UserNotFound() {
            super(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found");
        }
    }

    /** 400 Bad Request – Email already registered. */
    public static final class EmailAlreadyExists extends ApiException {
        public EmailAlreadyExists() {
            super(HttpStatus.BAD_REQUEST, "EMAIL_EXISTS", "Email already registered");
        }
    }

    /** 400 Bad Request – Admin tried to delete their own account. */
    public static final class CannotDeleteSelf extends ApiException {
        public CannotDeleteSelf() {
            super(HttpStatus.BAD_REQUEST, "CANNOT_DELETE_SELF", "Cannot delete your own account");
        }
    }

    /** 400 Bad Request – Role that cannot be chosen at self-registration. */
    public static final class RoleNotAllowed extends ApiException {
        public RoleNotAllowed(String role) {
            super(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Role '" + role + "' cannot be self-assigned");
        }
    }
}
