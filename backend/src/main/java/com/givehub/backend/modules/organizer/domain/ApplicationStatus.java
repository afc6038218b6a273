package com.givehub.backend.modules.organizer.domain;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Organizer application lifecycle: PENDING to APPROVED or REJECTED, both terminal.
 */
public enum ApplicationStatus {
    PENDING,
    APPROVED,
    REJECTED;

    private static final Map<ApplicationStatus, Set<ApplicationStatus>> ALLOWED_TRANSITIONS = Map.of(
            PENDING, EnumSet.of(APPROVED, REJECTED)
    );

    /** Statuses that block a new application from the same user. */
    public static final Set<ApplicationStatus> OPEN_STATUSES = EnumSet.of(PENDING, APPROVED);

    public boolean canTransitionTo(ApplicationStatus next) {
        return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(next);
    }

    public boolean isTerminal() {
        return !ALLOWED_TRANSITIONS.containsKey(this);
    }
}
