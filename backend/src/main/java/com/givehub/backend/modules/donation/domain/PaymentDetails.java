package com.givehub.backend.modules.donation.domain;

import java.util.Map;

/**
 * Payment metadata reported with a status update. Null fields keep the stored value.
 */
public record PaymentDetails(
        String transactionId,
        String payerEmail,
        String payerName,
        String payerCountry,
        Map<String, Object> captureDetails,
        CryptoCurrency cryptoCurrency,
        String transactionHash,
        CryptoNetwork network
) {
}
