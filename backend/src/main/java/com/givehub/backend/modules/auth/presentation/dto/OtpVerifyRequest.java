package com.givehub.backend.modules.auth.presentation.dto;

import com.givehub.backend.modules.auth.domain.OtpPurpose;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record OtpVerifyRequest(
        @NotBlank(message = "email is required") String email,
        @NotBlank(message = "code is required") @Pattern(regexp = "\\d{6}", message = "code must be 6 digits") String code,
        @NotNull(message = "purpose is required") OtpPurpose purpose
) {
}
