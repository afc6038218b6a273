package com.givehub.backend.modules.campaign.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.givehub.backend.modules.campaign.domain.Campaign;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CampaignRepository extends JpaRepository<Campaign, UUID>, CampaignRepositoryCustom {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from Campaign c where c.id = :id")
    Optional<Campaign> findByIdForUpdate(@Param("id") UUID id);

    @Query("select c from Campaign c join fetch c.owner where c.id = :id")
    Optional<Campaign> findWithOwnerById(@Param("id") UUID id);

    /**
     * Closes every open campaign of the owner in one statement.
     *
     * @return number of campaigns closed
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Campaign c
               set c.closed = true,
                   c.closedReason = :reason,
                   c.updatedAt = :now
             where c.owner.id = :ownerId
               and c.closed = false
            """)
    int closeOpenCampaignsByOwner(
            @Param("ownerId") UUID ownerId,
            @Param("reason") String reason,
            @Param("now") OffsetDateTime now
    );
}
