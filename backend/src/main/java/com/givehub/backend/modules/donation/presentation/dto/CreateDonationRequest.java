package com.givehub.backend.modules.donation.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

import com.givehub.backend.modules.donation.domain.CryptoCurrency;
import com.givehub.backend.modules.donation.domain.CryptoNetwork;
import com.givehub.backend.modules.donation.domain.DonationMethod;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;

public record CreateDonationRequest(
        UUID campaignId,
        @Digits(integer = 12, fraction = 2, message = "amount must have at most 2 decimal places") BigDecimal amount,
        DonationMethod method,
        @Size(max = 320) String donorEmail,
        CryptoCurrency cryptoCurrency,
        CryptoNetwork network,
        @Size(max = 200) String transactionHash
) {
}
