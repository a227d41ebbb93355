package com.shopnest.authservice.dto;

/** Only returned when reset-token exposure is switched on for local development. */
public record ResetTokenResponse(String resetToken) {
}
