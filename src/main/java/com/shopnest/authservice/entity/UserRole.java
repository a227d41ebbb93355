package com.shopnest.authservice.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Platform roles. Serialized in lower case ("customer", "admin", "vendor"),
 * which is also the value carried by the access token's {@code role} claim.
 */
public enum UserRole {
    CUSTOMER,
    ADMIN,
    VENDOR;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Spring Security authority name, e.g. {@code ROLE_ADMIN}. */
    public String authority() {
        return "ROLE_" + name();
    }

    @JsonCreator
    public static UserRole fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return UserRole.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown role: " + raw, e);
        }
    }
}
