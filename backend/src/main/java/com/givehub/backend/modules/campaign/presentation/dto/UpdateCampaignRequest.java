package com.givehub.backend.modules.campaign.presentation.dto;

import java.math.BigDecimal;
import java.util.List;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;

/**
 * Partial update. Null fields are left unchanged; ownership, approval and totals cannot be
 * changed through this request.
 */
public record UpdateCampaignRequest(
        @Size(max = 150, message = "title must be at most 150 characters") String title,
        @Size(max = 2000, message = "description must be at most 2000 characters") String description,
        List<@Size(max = 500) String> images,
        @Digits(integer = 12, fraction = 2, message = "target must have at most 2 decimal places") BigDecimal target
) {
}
