package com.schoolmate.backend.modules.audit.presentation.dto;

import java.util.List;

public record AuditLogPageResponse(
        List<AuditLogResponse> items,
        int page,
        int size,
        long totalElements
) {
}
