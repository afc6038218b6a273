package com.givehub.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.UUID;

import com.givehub.backend.global.error.ProblemException;
import com.givehub.backend.global.error.ProblemKind;
import com.givehub.backend.modules.auth.domain.UserRole;

import org.junit.jupiter.api.Test;

class OrganizerAccessGateTest {

    private final OrganizerAccessGate gate = new OrganizerAccessGate();

    @Test
    void revokedOrganizerIsBlocked() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> gate.requireActiveOrganizer(principal(UserRole.ORGANIZER, true, true)));

        assertThat(ex.getKind()).isEqualTo(ProblemKind.AUTHORIZATION);
        assertThat(ex.getCode()).isEqualTo("organizer.revoked");
    }

    @Test
    void unapprovedOrganizerIsBlocked() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> gate.requireActiveOrganizer(principal(UserRole.ORGANIZER, false, false)));

        assertThat(ex.getCode()).isEqualTo("organizer.pending_approval");
    }

    @Test
    void activeOrganizerAndOtherRolesPass() {
        assertDoesNotThrow(() -> gate.requireActiveOrganizer(principal(UserRole.ORGANIZER, true, false)));
        assertDoesNotThrow(() -> gate.requireActiveOrganizer(principal(UserRole.ADMIN, false, false)));
    }

    private static JwtAuthenticationPrincipal principal(UserRole role, boolean approved, boolean revoked) {
        return new JwtAuthenticationPrincipal(UUID.randomUUID(), "user@example.com", role, approved, revoked);
    }
}
