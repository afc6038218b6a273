package com.givehub.backend.modules.organizer.application;

/**
 * Organizer listing filter. Each value maps to a combination of the approval and revocation
 * flags; a null approval flag matches either value.
 */
public enum OrganizerStatusFilter {
    ACTIVE(Boolean.TRUE, Boolean.FALSE),
    REVOKED(null, Boolean.TRUE),
    PENDING(Boolean.FALSE, Boolean.FALSE);

    private final Boolean approved;
    private final Boolean revoked;

    OrganizerStatusFilter(Boolean approved, Boolean revoked) {
        this.approved = approved;
        this.revoked = revoked;
    }

    public Boolean approved() {
        return approved;
    }

    public Boolean revoked() {
        return revoked;
    }
}
