package com.schoolmate.backend.modules.audit.application;

import java.util.Map;
import java.util.UUID;

public record AuditRecordedEvent(
        String actionType,
        UUID schoolId,
        String resourceType,
        String resourceKey,
        UUID actorUserId,
        String correlationId,
        Map<String, Object> detail
) {
}
