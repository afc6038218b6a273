package com.givehub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Size;

public record UpdateProfileRequest(
        @Size(max = 100) String name,
        @Size(max = 40) String phoneNumber,
        @Size(max = 500) String imageUrl,
        @Size(min = 6, max = 128, message = "password must be 6-128 characters") String password
) {
}
