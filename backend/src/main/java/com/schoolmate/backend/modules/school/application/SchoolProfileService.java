package com.schoolmate.backend.modules.school.application;

import java.util.LinkedHashMap;
import java.util.Map;

import com.schoolmate.backend.global.error.ProblemException;
import com.schoolmate.backend.global.web.ClientRequestInfo;
import com.schoolmate.backend.modules.approval.application.EditTokenService;
import com.schoolmate.backend.modules.approval.application.VerifiedEditToken;
import com.schoolmate.backend.modules.audit.application.AuditLogService;
import com.schoolmate.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.schoolmate.backend.modules.school.domain.School;
import com.schoolmate.backend.modules.school.domain.SchoolLevels;
import com.schoolmate.backend.modules.school.domain.SchoolProfileChanges;
import com.schoolmate.backend.modules.school.domain.SchoolSnapshot;
import com.schoolmate.backend.modules.school.infrastructure.persistence.SchoolRepository;
import com.schoolmate.backend.modules.tenant.domain.SchoolContext;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * School profile reads and edits. Education-level changes go through an approval token; everything
 * else is applied directly.
 */
@Service
@Transactional
public class SchoolProfileService {

    static final String ACTION_PROFILE_UPDATE = "SCHOOL_PROFILE_UPDATE";
    static final String ACTION_SENSITIVE_CHANGE = "SCHOOL_PROFILE_SENSITIVE_CHANGE";
    private static final String RESOURCE_TYPE = "SCHOOL";

    private final SchoolRepository schoolRepository;
    private final EditTokenService editTokenService;
    private final AuditLogService auditLogService;

    public SchoolProfileService(
            SchoolRepository schoolRepository,
            EditTokenService editTokenService,
            AuditLogService auditLogService
    ) {
        this.schoolRepository = schoolRepository;
        this.editTokenService = editTokenService;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public SchoolSnapshot getCurrentSchool(SchoolContext context) {
        return SchoolSnapshot.of(loadSchool(context));
    }

    public SchoolSnapshot updateProfile(SchoolContext context, SchoolProfileChanges changes) {
        if (changes == null) {
            throw ProblemException.invalidInput("school.empty_update", "No changes supplied");
        }
        rejectRestricted(changes);

        School school = loadSchool(context);
        if (school.differsFrom(changes.levels())) {
            throw ProblemException.invalidInput(
                    "school.verification_required",
                    "Token verification required for school type changes. Please request a verification token first."
            );
        }
        applyBasicFields(school, changes);

        auditLogService.record(new AuditLogCommand(
                school.getId(),
                ACTION_PROFILE_UPDATE,
                RESOURCE_TYPE,
                school.getId().toString(),
                context.userId(),
                null,
                describe(changes)
        ));
        return SchoolSnapshot.of(school);
    }

    /**
     * Consumes the token and applies the change it approved. Both happen in one transaction, so a
     * failed apply leaves the token unused.
     */
    public SensitiveChangeResult confirmSensitiveChange(SchoolContext context, String token, ClientRequestInfo client) {
        VerifiedEditToken verified = editTokenService.verifyToken(token, context, client);
        SchoolProfileChanges approved = verified.proposedChanges();
        rejectRestricted(approved);

        School school = loadSchool(context);
        applyBasicFields(school, approved);
        school.applyLevels(approved.levels());

        Map<String, Object> detail = describe(approved);
        detail.put("previousLevels", levelsDetail(verified.currentSnapshot().levels()));
        detail.put("ipAddress", client.ipAddress());
        auditLogService.record(new AuditLogCommand(
                school.getId(),
                ACTION_SENSITIVE_CHANGE,
                RESOURCE_TYPE,
                school.getId().toString(),
                context.userId(),
                null,
                detail
        ));
        return new SensitiveChangeResult(approved, verified.currentSnapshot(), SchoolSnapshot.of(school));
    }

    private School loadSchool(SchoolContext context) {
        return schoolRepository.findById(context.schoolId())
                .orElseThrow(() -> ProblemException.notFound("school.not_found", "School not found"));
    }

    private void rejectRestricted(SchoolProfileChanges changes) {
        if (changes.touchesRestrictedFields()) {
            throw ProblemException.invalidInput(
                    "school.restricted_fields",
                    "You do not have permission to change restricted fields (subdomain, active)"
            );
        }
    }

    private void applyBasicFields(School school, SchoolProfileChanges changes) {
        if (changes.name() != null) {
            if (changes.name().isBlank()) {
                throw ProblemException.invalidInput("school.invalid_name", "School name must not be blank");
            }
            school.setName(changes.name().trim());
        }
        if (changes.address() != null) {
            school.setAddress(changes.address());
        }
        if (changes.email() != null) {
            school.setEmail(changes.email());
        }
        if (changes.phone() != null) {
            school.setPhone(changes.phone());
        }
    }

    private Map<String, Object> describe(SchoolProfileChanges changes) {
        Map<String, Object> detail = new LinkedHashMap<>();
        if (changes.name() != null) {
            detail.put("name", changes.name());
        }
        if (changes.address() != null) {
            detail.put("address", changes.address());
        }
        if (changes.email() != null) {
            detail.put("email", changes.email());
        }
        if (changes.phone() != null) {
            detail.put("phone", changes.phone());
        }
        if (changes.levels() != null && !changes.levels().specifiesNothing()) {
            detail.put("levels", levelsDetail(changes.levels()));
        }
        return detail;
    }

    private Map<String, Object> levelsDetail(SchoolLevels levels) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("primary", levels.primary());
        detail.put("secondary", levels.secondary());
        detail.put("tertiary", levels.tertiary());
        return detail;
    }

    public record SensitiveChangeResult(
            SchoolProfileChanges proposedChanges,
            SchoolSnapshot currentSnapshot,
            SchoolSnapshot updatedSchool
    ) {
    }
}
