package com.givehub.backend.modules.donation.domain;

public enum DonationMethod {
    PAYPAL,
    CRYPTO
}
