package com.givehub.backend.modules.auth.presentation.dto;

import com.givehub.backend.modules.auth.domain.OtpPurpose;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record OtpRequest(
        @NotBlank(message = "email is required") String email,
        @NotNull(message = "purpose is required") OtpPurpose purpose
) {
}
