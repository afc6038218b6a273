package com.givehub.backend.modules.donation.domain;

public enum CryptoNetwork {
    ETHEREUM,
    POLYGON,
    BSC
}
