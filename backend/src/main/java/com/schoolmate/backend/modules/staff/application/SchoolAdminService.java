package com.schoolmate.backend.modules.staff.application;

import java.util.List;
import java.util.UUID;

import com.schoolmate.backend.global.error.ProblemException;
import com.schoolmate.backend.modules.permission.domain.PrincipalRoleClassifier;
import com.schoolmate.backend.modules.school.infrastructure.persistence.SchoolRepository;
import com.schoolmate.backend.modules.staff.domain.SchoolAdmin;
import com.schoolmate.backend.modules.staff.infrastructure.persistence.SchoolAdminRepository;
import com.schoolmate.backend.modules.tenant.domain.SchoolContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class SchoolAdminService {

    private static final Logger log = LoggerFactory.getLogger(SchoolAdminService.class);

    private final SchoolAdminRepository schoolAdminRepository;
    private final SchoolRepository schoolRepository;

    public SchoolAdminService(SchoolAdminRepository schoolAdminRepository, SchoolRepository schoolRepository) {
        this.schoolAdminRepository = schoolAdminRepository;
        this.schoolRepository = schoolRepository;
    }

    /**
     * Creates an administrator. The Principal flag is decided here from the role label and never
     * recomputed afterwards. A school has at most one Principal, and only the Principal or a
     * platform operator may register an administrator with full access.
     */
    public SchoolAdmin registerAdmin(SchoolContext context, RegisterAdminCommand command) {
        UUID schoolId = context.schoolId();
        if (!schoolRepository.existsById(schoolId)) {
            throw ProblemException.notFound("school.not_found", "School not found");
        }
        if (schoolAdminRepository.existsByUserIdAndSchoolId(command.userId(), schoolId)) {
            throw duplicate(schoolId, command.userId());
        }

        boolean principal = PrincipalRoleClassifier.isPrincipal(command.role());
        if (principal) {
            requireFullAccessGrantor(context);
            if (schoolAdminRepository.existsBySchoolIdAndFullAccessTrue(schoolId)) {
                throw principalExists(command.role());
            }
        }

        SchoolAdmin admin = new SchoolAdmin(schoolId, command.userId(), command.role().trim(), principal);
        admin.setFirstName(command.firstName().trim());
        admin.setLastName(command.lastName().trim());
        admin.setEmail(command.email());
        try {
            SchoolAdmin saved = schoolAdminRepository.saveAndFlush(admin);
            log.info("School admin registered school={} admin={} role={} fullAccess={} by={}",
                    schoolId, saved.getId(), saved.getRole(), saved.isFullAccess(), context.userId());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            // either (school, user) or the single-Principal index; the user was checked above
            throw principal ? principalExists(command.role()) : duplicate(schoolId, command.userId());
        }
    }

    @Transactional(readOnly = true)
    public SchoolAdmin getAdmin(UUID schoolId, UUID adminId) {
        return schoolAdminRepository.findByIdAndSchoolId(adminId, schoolId)
                .orElseThrow(() -> ProblemException.notFound("staff.admin_not_found", "Admin not found"));
    }

    @Transactional(readOnly = true)
    public List<SchoolAdmin> listAdmins(UUID schoolId) {
        return schoolAdminRepository.findBySchoolIdOrderByCreatedAtAsc(schoolId);
    }

    private void requireFullAccessGrantor(SchoolContext context) {
        if (context.platformScope()) {
            return;
        }
        boolean callerIsPrincipal = context.adminId() != null && schoolAdminRepository
                .findByIdAndSchoolId(context.adminId(), context.schoolId())
                .map(SchoolAdmin::isFullAccess)
                .orElse(false);
        if (!callerIsPrincipal) {
            log.warn("Full-access registration refused school={} caller={}", context.schoolId(), context.userId());
            throw ProblemException.forbidden(
                    "staff.full_access_forbidden",
                    "Only the Principal or a platform operator may register a principal-level administrator"
            );
        }
    }

    private static ProblemException principalExists(String role) {
        return ProblemException.invalidOperation(
                "staff.principal_exists",
                "School already has a principal. Role '" + role.trim() + "' would be a second principal-level administrator."
        );
    }

    private ProblemException duplicate(UUID schoolId, UUID userId) {
        return ProblemException.invalidOperation(
                "staff.admin_exists",
                "User " + userId + " is already an administrator of school " + schoolId
        );
    }

    public record RegisterAdminCommand(
            UUID userId,
            String firstName,
            String lastName,
            String email,
            String role
    ) {
    }
}
