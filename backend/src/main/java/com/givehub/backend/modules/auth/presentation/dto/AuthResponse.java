package com.givehub.backend.modules.auth.presentation.dto;

public record AuthResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        UserProfileResponse user
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";
}
