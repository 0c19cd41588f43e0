package com.schoolmate.backend.modules.notification.application;

/**
 * Best-effort delivery port. Implementations may throw; callers decide whether a failure matters.
 */
public interface NotificationSender {

    void send(OutboundMessage message);
}
