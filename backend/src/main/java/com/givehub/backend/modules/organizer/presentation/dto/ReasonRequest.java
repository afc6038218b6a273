package com.givehub.backend.modules.organizer.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Optional free-text reason attached to reject and revoke actions.
 */
public record ReasonRequest(
        @Size(max = 1000, message = "reason must be at most 1000 characters") String reason
) {
}
