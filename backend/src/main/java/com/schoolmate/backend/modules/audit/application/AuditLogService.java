package com.schoolmate.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.schoolmate.backend.global.web.RequestIdFilter;
import com.schoolmate.backend.modules.audit.domain.AuditLog;
import com.schoolmate.backend.modules.audit.domain.PermissionChangeAuditEvent;
import com.schoolmate.backend.modules.audit.infrastructure.persistence.AuditLogRepository;

import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Stores the entry. The matching {@code AUDIT} log line is written by {@link AuditTrailLogger}
     * once the surrounding transaction commits.
     */
    @Transactional
    public AuditLog record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog entry = new AuditLog();
        entry.setSchoolId(command.schoolId());
        entry.setActionType(command.actionType());
        entry.setResourceType(command.resourceType());
        entry.setResourceKey(command.resourceKey());
        entry.setActorUserId(command.actorUserId());
        entry.setCorrelationId(command.correlationId() != null ? command.correlationId() : MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
        entry.setCreatedAt(OffsetDateTime.now(clock));

        if (command.detail() != null && !command.detail().isEmpty()) {
            entry.setDetail(new HashMap<>(command.detail()));
        }

        AuditLog saved = auditLogRepository.save(entry);
        eventPublisher.publishEvent(new AuditRecordedEvent(
                command.actionType(),
                command.schoolId(),
                command.resourceType(),
                command.resourceKey(),
                command.actorUserId(),
                entry.getCorrelationId(),
                command.detail()
        ));
        return saved;
    }

    @Transactional
    public AuditLog recordPermissionChange(PermissionChangeAuditEvent event) {
        return record(new AuditLogCommand(
                event.schoolId(),
                PermissionChangeAuditEvent.ACTION_TYPE,
                PermissionChangeAuditEvent.RESOURCE_TYPE,
                event.targetAdminId().toString(),
                event.callerUserId(),
                null,
                event.toDetail()
        ));
    }

    @Transactional(readOnly = true)
    public Page<AuditLog> findForSchool(UUID schoolId, String actionType, Pageable pageable) {
        if (actionType == null || actionType.isBlank()) {
            return auditLogRepository.findBySchoolIdOrderByCreatedAtDesc(schoolId, pageable);
        }
        return auditLogRepository.findBySchoolIdAndActionTypeOrderByCreatedAtDesc(schoolId, actionType, pageable);
    }

    public record AuditLogCommand(
            UUID schoolId,
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            String correlationId,
            Map<String, Object> detail
    ) {
    }
}
