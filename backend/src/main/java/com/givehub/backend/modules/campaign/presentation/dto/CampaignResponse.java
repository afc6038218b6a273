package com.givehub.backend.modules.campaign.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.campaign.domain.Campaign;

public record CampaignResponse(
        UUID id,
        String title,
        String description,
        List<String> images,
        BigDecimal target,
        BigDecimal raised,
        OwnerSummary owner,
        boolean approved,
        boolean closed,
        String closedReason,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static CampaignResponse from(Campaign campaign) {
        UserAccount owner = campaign.getOwner();
        return new CampaignResponse(
                campaign.getId(),
                campaign.getTitle(),
                campaign.getDescription(),
                List.copyOf(campaign.getImages()),
                campaign.getTarget(),
                campaign.getRaised(),
                new OwnerSummary(owner.getId(), owner.getName(), owner.getEmail()),
                campaign.isApproved(),
                campaign.isClosed(),
                campaign.getClosedReason(),
                campaign.getCreatedAt(),
                campaign.getUpdatedAt()
        );
    }

    public record OwnerSummary(UUID id, String name, String email) {
    }
}
