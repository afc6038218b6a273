package com.givehub.backend.modules.donation.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.givehub.backend.modules.donation.domain.Donation;
import com.givehub.backend.modules.donation.domain.DonationStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DonationRepository extends JpaRepository<Donation, UUID>, DonationRepositoryCustom {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from Donation d where d.id = :id")
    Optional<Donation> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
            select new com.givehub.backend.modules.donation.infrastructure.persistence.DonationTotals(
                       sum(d.amount), count(d), min(d.amount), max(d.amount))
              from Donation d
             where d.status = com.givehub.backend.modules.donation.domain.DonationStatus.COMPLETED
               and d.campaign.id = :campaignId
            """)
    DonationTotals summarizeCompleted(@Param("campaignId") UUID campaignId);

    @Query("""
            select new com.givehub.backend.modules.donation.infrastructure.persistence.DonationTotals(
                       sum(d.amount), count(d), min(d.amount), max(d.amount))
              from Donation d
             where d.status = com.givehub.backend.modules.donation.domain.DonationStatus.COMPLETED
            """)
    DonationTotals summarizeAllCompleted();

    @EntityGraph(attributePaths = {"donor"})
    Page<Donation> findByCampaignIdAndStatus(UUID campaignId, DonationStatus status, Pageable pageable);

    @EntityGraph(attributePaths = {"campaign"})
    List<Donation> findByDonorIdOrderByCreatedAtDesc(UUID donorId);
}
