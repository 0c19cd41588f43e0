package com.schoolmate.backend.modules.staff.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.schoolmate.backend.modules.staff.domain.SchoolAdmin;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SchoolAdminRepository extends JpaRepository<SchoolAdmin, UUID> {

    Optional<SchoolAdmin> findByIdAndSchoolId(UUID id, UUID schoolId);

    Optional<SchoolAdmin> findByUserIdAndSchoolId(UUID userId, UUID schoolId);

    boolean existsByUserIdAndSchoolId(UUID userId, UUID schoolId);

    boolean existsBySchoolIdAndFullAccessTrue(UUID schoolId);

    List<SchoolAdmin> findBySchoolIdOrderByCreatedAtAsc(UUID schoolId);

    /**
     * Principal contacts of a school, oldest first.
     */
    @Query("""
            select a
              from SchoolAdmin a
             where a.schoolId = :schoolId
               and a.fullAccess = true
               and a.email is not null
             order by a.createdAt asc
            """)
    List<SchoolAdmin> findPrincipalContacts(@Param("schoolId") UUID schoolId);

    /**
     * Locks the target admin row so concurrent grant replacements on the same admin serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from SchoolAdmin a where a.id = :id and a.schoolId = :schoolId")
    Optional<SchoolAdmin> findByIdAndSchoolIdForUpdate(@Param("id") UUID id, @Param("schoolId") UUID schoolId);
}
