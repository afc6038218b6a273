package com.givehub.backend.modules.campaign.infrastructure.persistence;

import java.util.UUID;

/**
 * Resolved listing filters. Null fields are not applied.
 */
public record CampaignSearchCondition(
        UUID ownerId,
        Boolean approved,
        Boolean closed,
        String search
) {
}
