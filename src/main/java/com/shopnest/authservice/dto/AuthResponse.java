package com.shopnest.authservice.dto;

public record AuthResponse(UserResponse user, TokenPair tokens) {
}
