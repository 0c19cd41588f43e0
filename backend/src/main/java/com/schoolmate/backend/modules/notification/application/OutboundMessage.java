package com.schoolmate.backend.modules.notification.application;

import java.util.Map;

/**
 * A message to deliver over an out-of-band channel such as e-mail.
 */
public record OutboundMessage(String recipient, String subject, String body, Map<String, Object> attributes) {

    public OutboundMessage {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
