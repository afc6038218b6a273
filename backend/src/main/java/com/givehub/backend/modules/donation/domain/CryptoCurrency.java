package com.givehub.backend.modules.donation.domain;

public enum CryptoCurrency {
    ETH,
    USDT,
    BTC
}
