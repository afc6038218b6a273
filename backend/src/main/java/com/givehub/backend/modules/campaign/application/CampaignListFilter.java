package com.givehub.backend.modules.campaign.application;

import java.util.UUID;

import com.givehub.backend.global.web.PageQuery;

/**
 * Campaign listing filters as requested by the caller, before visibility rules apply.
 */
public record CampaignListFilter(
        UUID owner,
        Boolean approved,
        Boolean closed,
        String search,
        PageQuery pageQuery
) {
}
