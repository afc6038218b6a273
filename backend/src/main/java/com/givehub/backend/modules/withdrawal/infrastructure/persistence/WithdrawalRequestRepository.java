package com.givehub.backend.modules.withdrawal.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.withdrawal.domain.WithdrawalRequest;
import com.givehub.backend.modules.withdrawal.domain.WithdrawalStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WithdrawalRequestRepository extends JpaRepository<WithdrawalRequest, UUID> {

    boolean existsByCampaignIdAndStatusIn(UUID campaignId, Collection<WithdrawalStatus> statuses);

    boolean existsByCampaignId(UUID campaignId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select w from WithdrawalRequest w where w.id = :id")
    Optional<WithdrawalRequest> findByIdForUpdate(@Param("id") UUID id);

    @EntityGraph(attributePaths = {"campaign", "organizer", "reviewedBy"})
    @Query("select w from WithdrawalRequest w where w.id = :id")
    Optional<WithdrawalRequest> findDetailedById(@Param("id") UUID id);

    @EntityGraph(attributePaths = {"campaign"})
    List<WithdrawalRequest> findByOrganizerIdOrderByCreatedAtDesc(UUID organizerId);

    @EntityGraph(attributePaths = {"campaign", "organizer"})
    @Query(value = """
            select w
              from WithdrawalRequest w
             where (:status is null or w.status = :status)
            """,
            countQuery = """
            select count(w)
              from WithdrawalRequest w
             where (:status is null or w.status = :status)
            """)
    Page<WithdrawalRequest> search(@Param("status") WithdrawalStatus status, Pageable pageable);

    /**
     * Rejects every pending request of the organizer in one statement.
     *
     * @return number of requests rejected
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update WithdrawalRequest w
               set w.status = com.givehub.backend.modules.withdrawal.domain.WithdrawalStatus.REJECTED,
                   w.adminMessage = :message,
                   w.reviewedBy = :admin,
                   w.updatedAt = :now
             where w.organizer.id = :organizerId
               and w.status = com.givehub.backend.modules.withdrawal.domain.WithdrawalStatus.PENDING
            """)
    int rejectPendingByOrganizer(
            @Param("organizerId") UUID organizerId,
            @Param("admin") UserAccount admin,
            @Param("message") String message,
            @Param("now") OffsetDateTime now
    );
}
