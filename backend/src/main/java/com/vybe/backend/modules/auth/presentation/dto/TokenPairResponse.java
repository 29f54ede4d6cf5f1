package com.vybe.backend.modules.auth.presentation.dto;

public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";
}
