package com.givehub.backend.modules.auth.domain;

public enum UserRole {
    DONOR,
    ORGANIZER,
    ADMIN
}
