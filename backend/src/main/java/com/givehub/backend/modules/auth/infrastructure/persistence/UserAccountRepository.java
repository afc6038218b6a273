package com.givehub.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.auth.domain.UserRole;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    @Query("select u from UserAccount u where lower(u.email) = lower(:email)")
    Optional<UserAccount> findByEmailIgnoreCase(@Param("email") String email);

    @Query("select case when count(u) > 0 then true else false end from UserAccount u where lower(u.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from UserAccount u where u.id = :id")
    Optional<UserAccount> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Organizer listing. {@code approved}/{@code revoked} left null match any value.
     */
    @Query(value = """
            select u
              from UserAccount u
             where u.role = :role
               and (:approved is null or u.organizerApproved = :approved)
               and (:revoked is null or u.organizerRevoked = :revoked)
            """,
            countQuery = """
            select count(u)
              from UserAccount u
             where u.role = :role
               and (:approved is null or u.organizerApproved = :approved)
               and (:revoked is null or u.organizerRevoked = :revoked)
            """)
    Page<UserAccount> findByRoleAndFlags(
            @Param("role") UserRole role,
            @Param("approved") Boolean approved,
            @Param("revoked") Boolean revoked,
            Pageable pageable
    );
}
