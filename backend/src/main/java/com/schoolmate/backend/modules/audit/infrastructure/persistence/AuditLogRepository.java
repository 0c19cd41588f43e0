package com.schoolmate.backend.modules.audit.infrastructure.persistence;

import java.util.UUID;

import com.schoolmate.backend.modules.audit.domain.AuditLog;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    Page<AuditLog> findBySchoolIdOrderByCreatedAtDesc(UUID schoolId, Pageable pageable);

    Page<AuditLog> findBySchoolIdAndActionTypeOrderByCreatedAtDesc(UUID schoolId, String actionType, Pageable pageable);
}
