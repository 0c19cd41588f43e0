package com.schoolmate.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.schoolmate.backend.modules.audit.domain.AuditLog;

public record AuditLogResponse(
        UUID id,
        String actionType,
        String resourceType,
        String resourceKey,
        UUID actorUserId,
        String correlationId,
        Map<String, Object> detail,
        OffsetDateTime createdAt
) {

    public static AuditLogResponse from(AuditLog log) {
        return new AuditLogResponse(
                log.getId(),
                log.getActionType(),
                log.getResourceType(),
                log.getResourceKey(),
                log.getActorUserId(),
                log.getCorrelationId(),
                log.getDetail() != null ? log.getDetail() : Map.of(),
                log.getCreatedAt()
        );
    }
}
