package com.givehub.backend.modules.donation.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.givehub.backend.modules.campaign.domain.Campaign;
import com.givehub.backend.modules.donation.domain.CryptoCurrency;
import com.givehub.backend.modules.donation.domain.CryptoNetwork;
import com.givehub.backend.modules.donation.domain.Donation;
import com.givehub.backend.modules.donation.domain.DonationMethod;
import com.givehub.backend.modules.donation.domain.DonationStatus;

public record DonationResponse(
        UUID id,
        UUID campaignId,
        String campaignTitle,
        UUID donorId,
        String donorEmail,
        BigDecimal amount,
        DonationMethod method,
        DonationStatus status,
        String transactionId,
        String payerEmail,
        String payerName,
        String payerCountry,
        Map<String, Object> captureDetails,
        CryptoCurrency cryptoCurrency,
        String transactionHash,
        CryptoNetwork network,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static DonationResponse from(Donation donation) {
        Campaign campaign = donation.getCampaign();
        return new DonationResponse(
                donation.getId(),
                campaign.getId(),
                campaign.getTitle(),
                donation.getDonor().getId(),
                donation.getDonorEmail(),
                donation.getAmount(),
                donation.getMethod(),
                donation.getStatus(),
                donation.getTransactionId(),
                donation.getPayerEmail(),
                donation.getPayerName(),
                donation.getPayerCountry(),
                donation.getCaptureDetails(),
                donation.getCryptoCurrency(),
                donation.getTransactionHash(),
                donation.getNetwork(),
                donation.getCreatedAt(),
                donation.getUpdatedAt()
        );
    }
}
