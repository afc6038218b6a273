package com.givehub.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.givehub.backend.modules.auth.domain.OneTimeCode;
import com.givehub.backend.modules.auth.domain.OtpPurpose;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OneTimeCodeRepository extends JpaRepository<OneTimeCode, UUID> {

    /**
     * Usable codes matching the value, newest first. The same value may be issued more than once.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select c
              from OneTimeCode c
             where c.email = :email
               and c.code = :code
               and c.purpose = :purpose
               and c.used = false
               and c.expiresAt > :now
             order by c.createdAt desc, c.id desc
            """)
    List<OneTimeCode> findUsableForUpdate(
            @Param("email") String email,
            @Param("code") String code,
            @Param("purpose") OtpPurpose purpose,
            @Param("now") OffsetDateTime now
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from OneTimeCode c where c.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
