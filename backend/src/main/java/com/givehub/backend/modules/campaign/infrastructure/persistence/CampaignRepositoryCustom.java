package com.givehub.backend.modules.campaign.infrastructure.persistence;

import com.givehub.backend.modules.campaign.domain.Campaign;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface CampaignRepositoryCustom {

    Page<Campaign> search(CampaignSearchCondition condition, Pageable pageable);
}
