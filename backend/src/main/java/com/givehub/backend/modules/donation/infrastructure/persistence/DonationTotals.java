package com.givehub.backend.modules.donation.infrastructure.persistence;

import java.math.BigDecimal;

/**
 * Aggregate over completed donations. Sum, min and max are null when there are none.
 */
public record DonationTotals(BigDecimal total, Long count, BigDecimal min, BigDecimal max) {
}
