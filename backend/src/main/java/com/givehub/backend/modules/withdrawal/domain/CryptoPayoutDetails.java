package com.givehub.backend.modules.withdrawal.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class CryptoPayoutDetails {

    @Column(name = "crypto_wallet_address", length = 128)
    private String walletAddress;

    @Column(name = "crypto_network", length = 32)
    private String network;

    protected CryptoPayoutDetails() {
    }

    public CryptoPayoutDetails(String walletAddress, String network) {
        this.walletAddress = walletAddress;
        this.network = network;
    }

    public String getWalletAddress() {
        return walletAddress;
    }

    public String getNetwork() {
        return network;
    }
}
