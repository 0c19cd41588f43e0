package com.schoolmate.backend.modules.permission.presentation;

import java.util.List;
import java.util.UUID;

import com.schoolmate.backend.global.error.ProblemException;
import com.schoolmate.backend.global.security.SecurityUtils;
import com.schoolmate.backend.global.web.ClientRequestInfo;
import com.schoolmate.backend.modules.permission.application.CallerContext;
import com.schoolmate.backend.modules.permission.application.MigrationResult;
import com.schoolmate.backend.modules.permission.application.PermissionCatalogService;
import com.schoolmate.backend.modules.permission.application.PermissionGrantService;
import com.schoolmate.backend.modules.permission.application.PermissionView;
import com.schoolmate.backend.modules.permission.application.StaffPermissionsView;
import com.schoolmate.backend.modules.permission.domain.PermissionResource;
import com.schoolmate.backend.modules.permission.domain.PermissionType;
import com.schoolmate.backend.modules.permission.presentation.dto.AssignPermissionsRequest;
import com.schoolmate.backend.modules.tenant.domain.SchoolContext;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/schools/{schoolId}")
public class PermissionController {

    private final PermissionCatalogService permissionCatalogService;
    private final PermissionGrantService permissionGrantService;

    public PermissionController(
            PermissionCatalogService permissionCatalogService,
            PermissionGrantService permissionGrantService
    ) {
        this.permissionCatalogService = permissionCatalogService;
        this.permissionGrantService = permissionGrantService;
    }

    @GetMapping("/permissions")
    @RequirePermission(resource = PermissionResource.STAFF, type = PermissionType.READ)
    public ResponseEntity<List<PermissionView>> getCatalog(@PathVariable("schoolId") UUID schoolId) {
        List<PermissionView> catalog = permissionCatalogService.listAll().stream()
                .map(PermissionView::from)
                .toList();
        return ResponseEntity.ok(catalog);
    }

    @Operation(
            summary = "Current administrator's permissions",
            description = "Needs only a resolved school so that a freshly created administrator can render the UI."
    )
    @GetMapping("/permissions/me")
    public ResponseEntity<StaffPermissionsView> getMyPermissions(SchoolContext context) {
        if (context.adminId() == null) {
            throw ProblemException.notFound("staff.admin_not_found", "Platform operators have no administrator profile");
        }
        return ResponseEntity.ok(permissionGrantService.getGrantsFor(context.schoolId(), context.adminId()));
    }

    @PostMapping("/permissions/migrate")
    @RequirePermission(resource = PermissionResource.STAFF, type = PermissionType.ADMIN)
    public ResponseEntity<MigrationResult> migrateExistingAdmins(SchoolContext context, HttpServletRequest request) {
        CallerContext caller = CallerContext.of(SecurityUtils.getCurrentPrincipal(), ClientRequestInfo.from(request).ipAddress());
        return ResponseEntity.ok(permissionGrantService.migrateExistingAdmins(context.schoolId(), caller));
    }

    @GetMapping("/admins/{adminId}/permissions")
    @RequirePermission(resource = PermissionResource.STAFF, type = PermissionType.READ)
    public ResponseEntity<StaffPermissionsView> getAdminPermissions(
            SchoolContext context,
            @PathVariable("adminId") UUID adminId
    ) {
        return ResponseEntity.ok(permissionGrantService.getGrantsFor(context.schoolId(), adminId));
    }

    @Operation(summary = "Replace an administrator's permissions")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Grant set replaced"),
            @ApiResponse(responseCode = "400", description = "Unknown permission ids, nothing was changed"),
            @ApiResponse(responseCode = "403", description = "Caller lacks STAFF:ADMIN or the ADMIN rights being granted"),
            @ApiResponse(responseCode = "404", description = "Administrator not found in this school"),
            @ApiResponse(responseCode = "409", description = "Target is a Principal")
    })
    @PutMapping("/admins/{adminId}/permissions")
    @RequirePermission(resource = PermissionResource.STAFF, type = PermissionType.ADMIN)
    public ResponseEntity<StaffPermissionsView> assignPermissions(
            SchoolContext context,
            @PathVariable("adminId") UUID adminId,
            @Valid @RequestBody AssignPermissionsRequest body,
            HttpServletRequest request
    ) {
        CallerContext caller = CallerContext.of(SecurityUtils.getCurrentPrincipal(), ClientRequestInfo.from(request).ipAddress());
        return ResponseEntity.ok(permissionGrantService.assignPermissions(
                context.schoolId(), adminId, body.permissionIds(), caller));
    }
}
