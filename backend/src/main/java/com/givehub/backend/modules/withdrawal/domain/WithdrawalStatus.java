package com.givehub.backend.modules.withdrawal.domain;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Payout lifecycle: PENDING to APPROVED or REJECTED, then APPROVED to PAID.
 */
public enum WithdrawalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    PAID;

    private static final Map<WithdrawalStatus, Set<WithdrawalStatus>> ALLOWED_TRANSITIONS = Map.of(
            PENDING, EnumSet.of(APPROVED, REJECTED),
            APPROVED, EnumSet.of(PAID)
    );

    /** A campaign may have at most one request in these statuses. */
    public static final Set<WithdrawalStatus> OUTSTANDING = EnumSet.of(PENDING, APPROVED);

    public boolean canTransitionTo(WithdrawalStatus next) {
        return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(next);
    }

    public boolean isTerminal() {
        return !ALLOWED_TRANSITIONS.containsKey(this);
    }
}
