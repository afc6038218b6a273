package com.givehub.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.auth.domain.UserRole;

public record UserProfileResponse(
        UUID id,
        String name,
        String email,
        UserRole role,
        String phoneNumber,
        String imageUrl,
        boolean organizerApproved,
        boolean organizerRevoked,
        OffsetDateTime revokedAt,
        String revocationReason,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserProfileResponse from(UserAccount user) {
        return new UserProfileResponse(
                user.getId(),
                user.getName(),
                user.getEmail(),
                user.getRole(),
                user.getPhoneNumber(),
                user.getImageUrl(),
                user.isOrganizerApproved(),
                user.isOrganizerRevoked(),
                user.getRevokedAt(),
                user.getRevocationReason(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
