package com.givehub.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OtpIssuedResponse(
        String message,
        OffsetDateTime expiresAt,
        String code
) {
}
