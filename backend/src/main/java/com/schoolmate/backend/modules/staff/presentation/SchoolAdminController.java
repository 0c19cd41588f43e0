package com.schoolmate.backend.modules.staff.presentation;

import java.util.List;

import com.schoolmate.backend.modules.permission.domain.PermissionResource;
import com.schoolmate.backend.modules.permission.domain.PermissionType;
import com.schoolmate.backend.modules.permission.presentation.RequirePermission;
import com.schoolmate.backend.modules.staff.application.SchoolAdminService;
import com.schoolmate.backend.modules.staff.application.SchoolAdminService.RegisterAdminCommand;
import com.schoolmate.backend.modules.staff.presentation.dto.RegisterAdminRequest;
import com.schoolmate.backend.modules.staff.presentation.dto.SchoolAdminResponse;
import com.schoolmate.backend.modules.tenant.domain.SchoolContext;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/schools/{schoolId}/admins")
public class SchoolAdminController {

    private final SchoolAdminService schoolAdminService;

    public SchoolAdminController(SchoolAdminService schoolAdminService) {
        this.schoolAdminService = schoolAdminService;
    }

    @GetMapping
    @RequirePermission(resource = PermissionResource.STAFF, type = PermissionType.READ)
    public ResponseEntity<List<SchoolAdminResponse>> listAdmins(SchoolContext context) {
        return ResponseEntity.ok(schoolAdminService.listAdmins(context.schoolId()).stream()
                .map(SchoolAdminResponse::from)
                .toList());
    }

    @PostMapping
    @RequirePermission(resource = PermissionResource.STAFF, type = PermissionType.WRITE)
    public ResponseEntity<SchoolAdminResponse> registerAdmin(
            SchoolContext context,
            @Valid @RequestBody RegisterAdminRequest request
    ) {
        RegisterAdminCommand command = new RegisterAdminCommand(
                request.userId(),
                request.firstName(),
                request.lastName(),
                request.email(),
                request.role()
        );
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SchoolAdminResponse.from(schoolAdminService.registerAdmin(context, command)));
    }
}
