package com.schoolmate.backend.modules.audit.presentation;

import com.schoolmate.backend.modules.audit.application.AuditLogService;
import com.schoolmate.backend.modules.audit.domain.AuditLog;
import com.schoolmate.backend.modules.audit.presentation.dto.AuditLogPageResponse;
import com.schoolmate.backend.modules.audit.presentation.dto.AuditLogResponse;
import com.schoolmate.backend.modules.permission.domain.PermissionResource;
import com.schoolmate.backend.modules.permission.domain.PermissionType;
import com.schoolmate.backend.modules.permission.presentation.RequirePermission;
import com.schoolmate.backend.modules.tenant.domain.SchoolContext;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/schools/{schoolId}/audit-logs")
public class AuditLogController {

    private static final int MAX_PAGE_SIZE = 100;

    private final AuditLogService auditLogService;

    public AuditLogController(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @GetMapping
    @RequirePermission(resource = PermissionResource.STAFF, type = PermissionType.ADMIN)
    public ResponseEntity<AuditLogPageResponse> getAuditLogs(
            SchoolContext context,
            @RequestParam(name = "actionType", required = false) String actionType,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        Page<AuditLog> result = auditLogService.findForSchool(
                context.schoolId(), actionType, PageRequest.of(safePage, safeSize));
        return ResponseEntity.ok(new AuditLogPageResponse(
                result.getContent().stream().map(AuditLogResponse::from).toList(),
                result.getNumber(),
                result.getSize(),
                result.getTotalElements()
        ));
    }
}
