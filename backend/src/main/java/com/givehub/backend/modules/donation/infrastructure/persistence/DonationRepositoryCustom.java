package com.givehub.backend.modules.donation.infrastructure.persistence;

import java.util.UUID;

import com.givehub.backend.modules.donation.domain.Donation;
import com.givehub.backend.modules.donation.domain.DonationMethod;
import com.givehub.backend.modules.donation.domain.DonationStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface DonationRepositoryCustom {

    /**
     * Admin listing, newest first. Null filters are not applied.
     */
    Page<Donation> search(DonationStatus status, DonationMethod method, UUID campaignId, Pageable pageable);
}
