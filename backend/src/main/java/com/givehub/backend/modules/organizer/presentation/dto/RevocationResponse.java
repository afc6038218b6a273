package com.givehub.backend.modules.organizer.presentation.dto;

import com.givehub.backend.modules.auth.presentation.dto.UserProfileResponse;

public record RevocationResponse(
        UserProfileResponse organizer,
        int closedCampaigns,
        int rejectedWithdrawals
) {
}
