package com.givehub.backend.modules.donation.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.givehub.backend.modules.donation.domain.Donation;
import com.givehub.backend.modules.donation.domain.DonationMethod;

/**
 * Donation as shown on a campaign's public page, without contact or payment data.
 */
public record PublicDonationResponse(
        UUID id,
        String donorName,
        BigDecimal amount,
        DonationMethod method,
        OffsetDateTime createdAt
) {

    public static PublicDonationResponse from(Donation donation) {
        return new PublicDonationResponse(
                donation.getId(),
                donation.getDonor().getName(),
                donation.getAmount(),
                donation.getMethod(),
                donation.getCreatedAt()
        );
    }
}
