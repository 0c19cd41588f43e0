package com.schoolmate.backend.modules.tenant.application;

import java.util.Optional;
import java.util.UUID;

import com.schoolmate.backend.global.error.ProblemException;
import com.schoolmate.backend.global.security.JwtAuthenticationPrincipal;
import com.schoolmate.backend.modules.school.domain.School;
import com.schoolmate.backend.modules.school.infrastructure.persistence.SchoolRepository;
import com.schoolmate.backend.modules.staff.domain.SchoolAdmin;
import com.schoolmate.backend.modules.staff.infrastructure.persistence.SchoolAdminRepository;
import com.schoolmate.backend.modules.tenant.domain.SchoolContext;
import com.schoolmate.backend.modules.tenant.domain.TenantHint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Establishes which school a request acts on. Only scope is decided here, never permissions.
 * <ul>
 *     <li>School administrators are pinned to the school in their access token. A hint naming any
 *     other school is rejected.</li>
 *     <li>Platform operators carry no school of their own and must name the target explicitly.</li>
 * </ul>
 */
@Service
public class TenantResolver {

    private static final Logger log = LoggerFactory.getLogger(TenantResolver.class);

    private final SchoolRepository schoolRepository;
    private final SchoolAdminRepository schoolAdminRepository;

    public TenantResolver(SchoolRepository schoolRepository, SchoolAdminRepository schoolAdminRepository) {
        this.schoolRepository = schoolRepository;
        this.schoolAdminRepository = schoolAdminRepository;
    }

    @Transactional(readOnly = true)
    public SchoolContext resolve(JwtAuthenticationPrincipal principal, TenantHint hint) {
        TenantHint effectiveHint = hint != null ? hint : TenantHint.none();

        if (principal.isPlatformAdmin()) {
            UUID target = resolveHint(effectiveHint)
                    .orElseThrow(() -> ProblemException.tenantRequired(
                            "Platform requests must name the target school"));
            if (!schoolRepository.existsById(target)) {
                throw ProblemException.notFound("school.not_found", "School not found");
            }
            return new SchoolContext(target, principal.userId(), true, null);
        }

        if (!principal.isSchoolAdmin()) {
            throw ProblemException.forbidden("tenant.forbidden", "This account cannot act within a school");
        }

        UUID currentSchoolId = principal.currentSchoolId();
        if (currentSchoolId == null) {
            throw ProblemException.tenantRequired("You are not associated with any school");
        }

        Optional<UUID> hinted = resolveHint(effectiveHint);
        if (hinted.isPresent() && !hinted.get().equals(currentSchoolId)) {
            log.warn("Cross-tenant access blocked user={} currentSchool={} requestedSchool={}",
                    principal.userId(), currentSchoolId, hinted.get());
            throw ProblemException.forbidden("tenant.forbidden", "You do not have access to this school");
        }

        SchoolAdmin admin = schoolAdminRepository.findByUserIdAndSchoolId(principal.userId(), currentSchoolId)
                .orElseThrow(() -> {
                    log.warn("School membership missing user={} school={}", principal.userId(), currentSchoolId);
                    return ProblemException.forbidden("tenant.forbidden", "You do not have access to this school");
                });
        return new SchoolContext(currentSchoolId, principal.userId(), false, admin.getId());
    }

    private Optional<UUID> resolveHint(TenantHint hint) {
        if (hint.schoolId() != null) {
            return Optional.of(hint.schoolId());
        }
        if (hint.subdomain() == null || hint.subdomain().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(schoolRepository.findBySubdomainIgnoreCase(hint.subdomain().trim())
                .map(School::getId)
                .orElseThrow(() -> ProblemException.notFound("school.not_found", "School not found")));
    }
}
