package com.schoolmate.backend.modules.school.presentation;

import com.schoolmate.backend.global.web.ClientRequestInfo;
import com.schoolmate.backend.modules.approval.application.EditTokenAcknowledgement;
import com.schoolmate.backend.modules.approval.application.EditTokenService;
import com.schoolmate.backend.modules.permission.domain.PermissionResource;
import com.schoolmate.backend.modules.permission.domain.PermissionType;
import com.schoolmate.backend.modules.permission.presentation.RequirePermission;
import com.schoolmate.backend.modules.school.application.SchoolProfileService;
import com.schoolmate.backend.modules.school.application.SchoolProfileService.SensitiveChangeResult;
import com.schoolmate.backend.modules.school.domain.SchoolSnapshot;
import com.schoolmate.backend.modules.school.presentation.dto.UpdateSchoolProfileRequest;
import com.schoolmate.backend.modules.school.presentation.dto.VerifyEditTokenRequest;
import com.schoolmate.backend.modules.tenant.domain.SchoolContext;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/schools/current")
public class SchoolProfileController {

    private final SchoolProfileService schoolProfileService;
    private final EditTokenService editTokenService;

    public SchoolProfileController(SchoolProfileService schoolProfileService, EditTokenService editTokenService) {
        this.schoolProfileService = schoolProfileService;
        this.editTokenService = editTokenService;
    }

    @GetMapping("/me")
    public ResponseEntity<SchoolSnapshot> getCurrentSchool(SchoolContext context) {
        return ResponseEntity.ok(schoolProfileService.getCurrentSchool(context));
    }

    @Operation(summary = "Update basic school profile fields")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Profile updated"),
            @ApiResponse(responseCode = "400", description = "Restricted fields or an education-level change without a token")
    })
    @PatchMapping("/profile")
    @RequirePermission(resource = PermissionResource.OVERVIEW, type = PermissionType.ADMIN)
    public ResponseEntity<SchoolSnapshot> updateProfile(
            SchoolContext context,
            @Valid @RequestBody UpdateSchoolProfileRequest request
    ) {
        return ResponseEntity.ok(schoolProfileService.updateProfile(context, request.toChanges()));
    }

    @Operation(
            summary = "Request approval for an education-level change",
            description = "Issues a single-use token and sends it to the school's Principal."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Token issued, Principal contacted"),
            @ApiResponse(responseCode = "400", description = "No sensitive change or no Principal contact"),
            @ApiResponse(responseCode = "429", description = "Too many token requests")
    })
    @PostMapping("/profile/edit-token")
    @RequirePermission(resource = PermissionResource.OVERVIEW, type = PermissionType.ADMIN)
    public ResponseEntity<EditTokenAcknowledgement> requestEditToken(
            SchoolContext context,
            @Valid @RequestBody UpdateSchoolProfileRequest body,
            HttpServletRequest request
    ) {
        return ResponseEntity.ok(editTokenService.requestToken(
                context, body.toChanges(), ClientRequestInfo.from(request)));
    }

    @Operation(summary = "Verify an approval token and apply the approved change")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Change applied"),
            @ApiResponse(responseCode = "400", description = "Token invalid, expired, used or issued to someone else"),
            @ApiResponse(responseCode = "429", description = "Too many verification attempts")
    })
    @PostMapping("/profile/edit-token/verify")
    @RequirePermission(resource = PermissionResource.OVERVIEW, type = PermissionType.ADMIN)
    public ResponseEntity<SensitiveChangeResult> verifyEditToken(
            SchoolContext context,
            @Valid @RequestBody VerifyEditTokenRequest body,
            HttpServletRequest request
    ) {
        return ResponseEntity.ok(schoolProfileService.confirmSensitiveChange(
                context, body.token(), ClientRequestInfo.from(request)));
    }
}
