package com.givehub.backend.modules.donation.domain;

/**
 * Change a donation status transition applies to its campaign's raised total.
 */
public enum BalanceEffect {
    CREDIT,
    DEBIT,
    NONE
}
