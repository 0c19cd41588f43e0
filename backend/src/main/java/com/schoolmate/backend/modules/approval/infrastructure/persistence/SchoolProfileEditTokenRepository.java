package com.schoolmate.backend.modules.approval.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.schoolmate.backend.modules.approval.domain.SchoolProfileEditToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SchoolProfileEditTokenRepository extends JpaRepository<SchoolProfileEditToken, UUID> {

    Optional<SchoolProfileEditToken> findByTokenHash(String tokenHash);

    /**
     * Consumes a token only if it is still pending.
     *
     * @return 1 for the single caller that won, 0 for everyone else
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update SchoolProfileEditToken t
               set t.usedAt = :now
             where t.id = :id
               and t.usedAt is null
               and t.expiresAt > :now
            """)
    int markUsed(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            delete from SchoolProfileEditToken t
             where (t.usedAt is null and t.expiresAt <= :now)
                or (t.usedAt is not null and t.usedAt < :consumedBefore)
            """)
    int deleteExpiredOrConsumed(@Param("now") OffsetDateTime now,
                                @Param("consumedBefore") OffsetDateTime consumedBefore);
}
