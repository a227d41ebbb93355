package com.shopnest.authservice.dto;

public record TokenPair(String accessToken, String refreshToken) {
}
