package com.givehub.backend.modules.auth.domain;

public enum OtpPurpose {
    REGISTER,
    FORGOT_PASSWORD
}
