package com.givehub.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
