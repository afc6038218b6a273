package com.givehub.backend.modules.donation.presentation.dto;

import java.util.Map;

import com.givehub.backend.modules.donation.domain.CryptoCurrency;
import com.givehub.backend.modules.donation.domain.CryptoNetwork;
import com.givehub.backend.modules.donation.domain.DonationStatus;
import com.givehub.backend.modules.donation.domain.PaymentDetails;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record UpdateDonationStatusRequest(
        @NotNull(message = "status is required") DonationStatus status,
        @Size(max = 200) String transactionId,
        @Size(max = 320) String payerEmail,
        @Size(max = 200) String payerName,
        @Size(max = 8) String payerCountry,
        Map<String, Object> captureDetails,
        CryptoCurrency cryptoCurrency,
        @Size(max = 200) String transactionHash,
        CryptoNetwork network
) {

    public PaymentDetails paymentDetails() {
        return new PaymentDetails(transactionId, payerEmail, payerName, payerCountry,
                captureDetails, cryptoCurrency, transactionHash, network);
    }
}
