package com.schoolmate.backend.modules.notification.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.schoolmate.backend.modules.notification.domain.Notification;

import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    List<Notification> findBySchoolIdAndRecipientAdminIdOrderByCreatedAtDesc(UUID schoolId, UUID recipientAdminId);
}
