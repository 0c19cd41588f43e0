package com.schoolmate.backend.modules.approval.application;

import java.util.Map;

import com.schoolmate.backend.modules.notification.application.NotificationSender;
import com.schoolmate.backend.modules.notification.application.OutboundMessage;
import com.schoolmate.backend.modules.school.domain.SchoolLevels;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Delivers freshly issued edit tokens to the school's Principal once the token row is committed.
 * A failed delivery leaves the token unusable in practice; the requester simply asks again.
 */
@Component
public class EditTokenDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EditTokenDispatcher.class);

    private final NotificationSender notificationSender;

    public EditTokenDispatcher(NotificationSender notificationSender) {
        this.notificationSender = notificationSender;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTokenIssued(EditTokenIssuedEvent event) {
        SchoolLevels levels = event.proposedChanges().levels();
        String body = "Hello " + event.recipientName() + ",\n\n"
                + "A change to the education levels of " + event.schoolName() + " is waiting for your approval.\n"
                + "Requested levels: primary=" + levels.primary()
                + ", secondary=" + levels.secondary()
                + ", tertiary=" + levels.tertiary() + "\n\n"
                + "Verification code: " + event.token() + "\n"
                + "This code expires at " + event.expiresAt() + ".";
        try {
            notificationSender.send(new OutboundMessage(
                    event.recipientEmail(),
                    "Confirm school profile change for " + event.schoolName(),
                    body,
                    Map.of("schoolId", event.schoolId().toString(), "kind", "SCHOOL_PROFILE_EDIT_TOKEN")
            ));
        } catch (RuntimeException ex) {
            log.error("Failed to deliver edit token school={} recipient={}", event.schoolId(), event.recipientEmail(), ex);
        }
    }
}
