package com.givehub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @Size(max = 100) String name,
        @Email(message = "email must be a valid address") String email,
        @Size(min = 6, max = 128, message = "password must be 6-128 characters") String password,
        @Size(max = 40) String phoneNumber
) {
}
