package com.schoolmate.backend.modules.notification.presentation;

import java.util.List;
import java.util.UUID;

import com.schoolmate.backend.global.error.ProblemException;
import com.schoolmate.backend.modules.notification.application.NotificationService;
import com.schoolmate.backend.modules.notification.presentation.dto.NotificationResponse;
import com.schoolmate.backend.modules.tenant.domain.SchoolContext;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbox of the calling administrator. Needs no permission beyond membership in the school.
 */
@RestController
@RequestMapping("/schools/{schoolId}/notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<List<NotificationResponse>> getMyNotifications(SchoolContext context) {
        UUID adminId = requireAdmin(context);
        return ResponseEntity.ok(notificationService.getNotifications(context.schoolId(), adminId).stream()
                .map(NotificationResponse::from)
                .toList());
    }

    @PatchMapping("/{notificationId}/read")
    public ResponseEntity<Void> markRead(SchoolContext context, @PathVariable("notificationId") UUID notificationId) {
        notificationService.markRead(context.schoolId(), requireAdmin(context), notificationId);
        return ResponseEntity.noContent().build();
    }

    private static UUID requireAdmin(SchoolContext context) {
        if (context.adminId() == null) {
            throw ProblemException.notFound("staff.admin_not_found", "Platform operators have no administrator profile");
        }
        return context.adminId();
    }
}
