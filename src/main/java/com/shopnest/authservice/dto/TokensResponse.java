package com.shopnest.authservice.dto;

public record TokensResponse(TokenPair tokens) {
}
