package com.givehub.backend.modules.organizer.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.givehub.backend.modules.organizer.domain.ApplicationStatus;
import com.givehub.backend.modules.organizer.domain.OrganizerApplication;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrganizerApplicationRepository extends JpaRepository<OrganizerApplication, UUID> {

    boolean existsByUserIdAndStatusIn(UUID userId, Collection<ApplicationStatus> statuses);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from OrganizerApplication a where a.id = :id")
    Optional<OrganizerApplication> findByIdForUpdate(@Param("id") UUID id);

    @EntityGraph(attributePaths = {"user"})
    List<OrganizerApplication> findByUserIdOrderByCreatedAtDesc(UUID userId);

    @EntityGraph(attributePaths = {"user"})
    @Query(value = """
            select a
              from OrganizerApplication a
             where (:status is null or a.status = :status)
            """,
            countQuery = """
            select count(a)
              from OrganizerApplication a
             where (:status is null or a.status = :status)
            """)
    Page<OrganizerApplication> search(@Param("status") ApplicationStatus status, Pageable pageable);

    @EntityGraph(attributePaths = {"user", "reviewedBy"})
    @Query("select a from OrganizerApplication a where a.id = :id")
    Optional<OrganizerApplication> findDetailedById(@Param("id") UUID id);
}
