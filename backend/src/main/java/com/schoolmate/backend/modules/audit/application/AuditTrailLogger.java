package com.schoolmate.backend.modules.audit.application;

import com.schoolmate.backend.modules.audit.domain.PermissionChangeAuditEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Writes committed audit entries to the {@code AUDIT} logger. Entries from a rolled-back
 * transaction never reach the log.
 */
@Component
public class AuditTrailLogger {

    private static final Logger auditLog = LoggerFactory.getLogger("AUDIT");

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onAuditRecorded(AuditRecordedEvent event) {
        auditLog.info("event={} school={} resource={}:{} actor={} correlation={} detail={}",
                event.actionType(),
                event.schoolId(),
                event.resourceType(),
                event.resourceKey(),
                event.actorUserId() != null ? event.actorUserId() : PermissionChangeAuditEvent.SYSTEM_CALLER,
                event.correlationId(),
                event.detail());
    }
}
