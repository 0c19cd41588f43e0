package com.schoolmate.backend.modules.notification.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import com.schoolmate.backend.modules.notification.application.NotificationService.NotificationCommand;
import com.schoolmate.backend.modules.permission.application.PermissionView;
import com.schoolmate.backend.modules.permission.application.PermissionsChangedEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Tells an administrator that their permissions changed. Runs after the grant transaction commits;
 * any failure here is logged and never affects the stored grants.
 */
@Component
public class PermissionChangeNotifier {

    private static final Logger log = LoggerFactory.getLogger(PermissionChangeNotifier.class);

    private final NotificationService notificationService;
    private final NotificationSender notificationSender;

    public PermissionChangeNotifier(NotificationService notificationService, NotificationSender notificationSender) {
        this.notificationService = notificationService;
        this.notificationSender = notificationSender;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPermissionsChanged(PermissionsChangedEvent event) {
        String summary = event.permissions().isEmpty()
                ? "You currently have no permissions assigned."
                : event.permissions().stream()
                        .map(PermissionView::description)
                        .collect(Collectors.joining("\n- ", "Your permissions:\n- ", ""));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("permissionCount", event.permissions().size());
        metadata.put("permissions", event.permissions().stream()
                .map(permission -> permission.resource() + ":" + permission.type())
                .toList());

        try {
            notificationService.createNotification(new NotificationCommand(
                    event.schoolId(),
                    event.adminId(),
                    NotificationService.KIND_PERMISSIONS_CHANGED,
                    "Your permissions were updated",
                    summary,
                    metadata
            ));
        } catch (RuntimeException ex) {
            log.error("Failed to store permission notification admin={} school={}", event.adminId(), event.schoolId(), ex);
        }

        if (event.adminEmail() == null || event.adminEmail().isBlank() || event.permissions().isEmpty()) {
            return;
        }
        try {
            notificationSender.send(new OutboundMessage(
                    event.adminEmail(),
                    "Your SchoolMate permissions were updated",
                    "Hello " + event.adminName() + ",\n\n" + summary,
                    metadata
            ));
        } catch (RuntimeException ex) {
            log.error("Failed to send permission assignment message admin={} school={}", event.adminId(), event.schoolId(), ex);
        }
    }
}
