package com.schoolmate.backend.modules.notification.infrastructure.sender;

import com.schoolmate.backend.modules.notification.application.NotificationSender;
import com.schoolmate.backend.modules.notification.application.OutboundMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default sender used until a mail provider is wired in. Message bodies may contain one-time
 * codes, so only metadata is logged.
 */
@Component
public class LoggingNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSender.class);

    @Override
    public void send(OutboundMessage message) {
        log.info("Outbound message queued recipient={} subject={} attributes={}",
                message.recipient(), message.subject(), message.attributes().keySet());
    }
}
