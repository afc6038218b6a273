package com.givehub.backend.modules.donation.presentation.dto;

import java.math.BigDecimal;

public record DonationStatsResponse(
        BigDecimal totalAmount,
        long count,
        BigDecimal averageAmount,
        BigDecimal minAmount,
        BigDecimal maxAmount
) {
}
