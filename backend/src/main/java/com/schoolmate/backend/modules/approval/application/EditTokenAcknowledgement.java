package com.schoolmate.backend.modules.approval.application;

import java.time.OffsetDateTime;

public record EditTokenAcknowledgement(boolean acknowledged, String deliveredTo, OffsetDateTime expiresAt) {
}
