package com.schoolmate.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.schoolmate.backend.modules.notification.domain.Notification;

public record NotificationResponse(
        UUID id,
        String kindCode,
        String title,
        String body,
        Map<String, Object> metadata,
        OffsetDateTime createdAt,
        OffsetDateTime readAt
) {

    public static NotificationResponse from(Notification notification) {
        return new NotificationResponse(
                notification.getId(),
                notification.getKindCode(),
                notification.getTitle(),
                notification.getBody(),
                notification.getMetadata() != null ? notification.getMetadata() : Map.of(),
                notification.getCreatedAt(),
                notification.getReadAt()
        );
    }
}
