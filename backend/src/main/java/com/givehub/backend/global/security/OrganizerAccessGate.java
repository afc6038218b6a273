package com.givehub.backend.global.security;

import com.givehub.backend.global.error.ProblemException;
import com.givehub.backend.modules.auth.domain.UserRole;

import org.springframework.stereotype.Component;

/**
 * Blocks organizer-only actions for organizers that are revoked or not yet approved.
 * Other roles pass through; role restrictions are applied by the security filter chain.
 */
@Component
public class OrganizerAccessGate {

    public void requireActiveOrganizer(JwtAuthenticationPrincipal principal) {
        if (principal.role() != UserRole.ORGANIZER) {
            return;
        }
        if (principal.organizerRevoked()) {
            throw ProblemException.forbidden("organizer.revoked", "Your organizer account has been revoked");
        }
        if (!principal.organizerApproved()) {
            throw ProblemException.forbidden("organizer.pending_approval", "Your organizer account is pending approval");
        }
    }
}
