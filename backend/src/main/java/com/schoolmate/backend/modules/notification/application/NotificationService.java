package com.schoolmate.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.schoolmate.backend.global.error.ProblemException;
import com.schoolmate.backend.modules.notification.domain.Notification;
import com.schoolmate.backend.modules.notification.infrastructure.persistence.NotificationRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class NotificationService {

    public static final String KIND_PERMISSIONS_CHANGED = "PERMISSIONS_CHANGED";

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public NotificationService(NotificationRepository notificationRepository, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    /**
     * Stores an in-app notification in its own transaction so it can be called after the
     * originating transaction has already committed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Notification createNotification(NotificationCommand command) {
        Notification notification = new Notification();
        notification.setSchoolId(command.schoolId());
        notification.setRecipientAdminId(command.recipientAdminId());
        notification.setKindCode(command.kindCode());
        notification.setTitle(command.title());
        notification.setBody(command.body());
        if (command.metadata() != null && !command.metadata().isEmpty()) {
            notification.setMetadata(new HashMap<>(command.metadata()));
        }
        notification.setCreatedAt(OffsetDateTime.now(clock));
        return notificationRepository.save(notification);
    }

    @Transactional(readOnly = true)
    public List<Notification> getNotifications(UUID schoolId, UUID adminId) {
        return notificationRepository.findBySchoolIdAndRecipientAdminIdOrderByCreatedAtDesc(schoolId, adminId);
    }

    public void markRead(UUID schoolId, UUID adminId, UUID notificationId) {
        Notification notification = notificationRepository.findById(notificationId)
                .filter(candidate -> candidate.getSchoolId().equals(schoolId))
                .filter(candidate -> candidate.getRecipientAdminId().equals(adminId))
                .orElseThrow(() -> ProblemException.notFound("notification.not_found", "Notification not found"));
        if (notification.getReadAt() == null) {
            notification.markRead(OffsetDateTime.now(clock));
        }
    }

    public record NotificationCommand(
            UUID schoolId,
            UUID recipientAdminId,
            String kindCode,
            String title,
            String body,
            Map<String, Object> metadata
    ) {
    }
}
