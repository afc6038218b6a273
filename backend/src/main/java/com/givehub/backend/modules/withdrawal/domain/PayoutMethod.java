package com.givehub.backend.modules.withdrawal.domain;

public enum PayoutMethod {
    BANK,
    PAYPAL,
    CRYPTO
}
