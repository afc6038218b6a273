package com.givehub.backend.global.security;

import java.util.UUID;

import com.givehub.backend.modules.auth.domain.UserRole;

public record JwtAuthenticationPrincipal(
        UUID userId,
        String email,
        UserRole role,
        boolean organizerApproved,
        boolean organizerRevoked
) {

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
