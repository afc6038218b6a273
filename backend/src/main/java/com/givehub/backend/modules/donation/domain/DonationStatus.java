package com.givehub.backend.modules.donation.domain;

/**
 * Donation payment status. Any status may be set again; the campaign balance follows through
 * {@link #balanceEffectOf(DonationStatus, DonationStatus)}.
 */
public enum DonationStatus {
    PENDING,
    COMPLETED,
    FAILED;

    /**
     * Entering COMPLETED credits the campaign, leaving COMPLETED for FAILED debits it, and every
     * other transition (including COMPLETED to COMPLETED) leaves it untouched.
     */
    public static BalanceEffect balanceEffectOf(DonationStatus previous, DonationStatus next) {
        if (next == COMPLETED && previous != COMPLETED) {
            return BalanceEffect.CREDIT;
        }
        if (next == FAILED && previous == COMPLETED) {
            return BalanceEffect.DEBIT;
        }
        return BalanceEffect.NONE;
    }
}
