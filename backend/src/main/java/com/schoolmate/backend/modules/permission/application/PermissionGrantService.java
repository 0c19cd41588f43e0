package com.schoolmate.backend.modules.permission.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.schoolmate.backend.global.error.ProblemException;
import com.schoolmate.backend.modules.audit.application.AuditLogService;
import com.schoolmate.backend.modules.audit.domain.PermissionChangeAuditEvent;
import com.schoolmate.backend.modules.permission.domain.ActorGrants;
import com.schoolmate.backend.modules.permission.domain.Permission;
import com.schoolmate.backend.modules.permission.domain.PermissionEvaluator;
import com.schoolmate.backend.modules.permission.domain.PermissionKey;
import com.schoolmate.backend.modules.permission.domain.PermissionResource;
import com.schoolmate.backend.modules.permission.domain.PermissionType;
import com.schoolmate.backend.modules.permission.domain.StaffPermission;
import com.schoolmate.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.schoolmate.backend.modules.permission.infrastructure.persistence.StaffPermissionRepository;
import com.schoolmate.backend.modules.staff.domain.SchoolAdmin;
import com.schoolmate.backend.modules.staff.infrastructure.persistence.SchoolAdminRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The only write path for administrator grants. Every assignment replaces the whole grant set.
 */
@Service
public class PermissionGrantService {

    private static final Logger log = LoggerFactory.getLogger(PermissionGrantService.class);

    private final SchoolAdminRepository schoolAdminRepository;
    private final PermissionRepository permissionRepository;
    private final StaffPermissionRepository staffPermissionRepository;
    private final AuditLogService auditLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public PermissionGrantService(
            SchoolAdminRepository schoolAdminRepository,
            PermissionRepository permissionRepository,
            StaffPermissionRepository staffPermissionRepository,
            AuditLogService auditLogService,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.schoolAdminRepository = schoolAdminRepository;
        this.permissionRepository = permissionRepository;
        this.staffPermissionRepository = staffPermissionRepository;
        this.auditLogService = auditLogService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public StaffPermissionsView getGrantsFor(UUID schoolId, UUID adminId) {
        SchoolAdmin admin = findAdmin(schoolId, adminId);
        if (admin.isFullAccess()) {
            return toView(admin, List.of());
        }
        return toView(admin, loadPermissions(admin.getId()));
    }

    @Transactional(readOnly = true)
    public boolean hasPermission(UUID schoolId, UUID adminId, PermissionResource resource, PermissionType type) {
        return PermissionEvaluator.hasPermission(loadActorGrants(findAdmin(schoolId, adminId)), resource, type);
    }

    @Transactional(readOnly = true)
    public boolean hasAdminPermission(UUID schoolId, UUID adminId, PermissionResource resource) {
        return PermissionEvaluator.hasAdminAccess(loadActorGrants(findAdmin(schoolId, adminId)), resource);
    }

    /**
     * Live grant snapshot used by the evaluator. Principals are never looked up in the grant table.
     */
    @Transactional(readOnly = true)
    public ActorGrants loadActorGrants(SchoolAdmin admin) {
        if (admin.isFullAccess()) {
            return ActorGrants.principal(admin.getId(), admin.getRole());
        }
        Set<PermissionKey> keys = loadPermissions(admin.getId()).stream()
                .map(Permission::key)
                .collect(Collectors.toSet());
        return new ActorGrants(admin.getId(), admin.getRole(), false, keys);
    }

    @Transactional
    public StaffPermissionsView assignPermissions(
            UUID schoolId,
            UUID targetAdminId,
            List<UUID> permissionIds,
            CallerContext caller
    ) {
        if (permissionIds == null || permissionIds.stream().anyMatch(Objects::isNull)) {
            throw ProblemException.invalidInput("permission.invalid_ids", "permissionIds must be a list of ids");
        }
        List<UUID> requestedIds = new ArrayList<>(new LinkedHashSet<>(permissionIds));

        SchoolAdmin target = schoolAdminRepository.findByIdAndSchoolIdForUpdate(targetAdminId, schoolId)
                .orElseThrow(() -> ProblemException.notFound("staff.admin_not_found", "Admin not found"));

        if (target.isFullAccess()) {
            throw ProblemException.invalidOperation(
                    "permission.principal_immutable",
                    "Principal permissions cannot be modified. Principals have permanent full access to all school resources."
            );
        }

        Map<UUID, Permission> catalogById = permissionRepository.findAllById(requestedIds).stream()
                .collect(Collectors.toMap(Permission::getId, Function.identity()));

        if (caller != null && caller.isTenantScoped()) {
            authorizeGrantor(schoolId, target, catalogById.values(), caller);
        }

        List<UUID> unknownIds = requestedIds.stream()
                .filter(id -> !catalogById.containsKey(id))
                .toList();
        if (!unknownIds.isEmpty()) {
            throw ProblemException.invalidInput("permission.unknown_ids", "One or more permissions not found: " + unknownIds);
        }

        List<Permission> previous = loadPermissions(target.getId());
        List<Permission> requested = requestedIds.stream().map(catalogById::get).toList();

        staffPermissionRepository.deleteByAdminId(target.getId());
        OffsetDateTime now = OffsetDateTime.now(clock);
        staffPermissionRepository.saveAll(requested.stream()
                .map(permission -> new StaffPermission(target, permission, now))
                .toList());

        recordChange(schoolId, target, previous, requested, caller, now);

        StaffPermissionsView view = toView(target, requested);
        eventPublisher.publishEvent(new PermissionsChangedEvent(
                schoolId,
                target.getId(),
                target.getFullName(),
                target.getEmail(),
                view.permissions()
        ));
        return view;
    }

    /**
     * Gives every READ permission to administrators that predate the permission system.
     * Principals and administrators that already hold grants are skipped.
     */
    @Transactional
    public MigrationResult migrateExistingAdmins(UUID schoolId, CallerContext caller) {
        List<Permission> readPermissions = permissionRepository.findByType(PermissionType.READ);
        if (readPermissions.isEmpty()) {
            throw ProblemException.invalidInput(
                    "permission.catalog_empty",
                    "No READ permissions found. Please initialize permissions first."
            );
        }

        Set<UUID> adminsWithGrants = Set.copyOf(staffPermissionRepository.findAdminIdsWithGrants(schoolId));
        OffsetDateTime now = OffsetDateTime.now(clock);
        int migrated = 0;
        int skipped = 0;
        for (SchoolAdmin admin : schoolAdminRepository.findBySchoolIdOrderByCreatedAtAsc(schoolId)) {
            if (admin.isFullAccess() || adminsWithGrants.contains(admin.getId())) {
                skipped++;
                continue;
            }
            staffPermissionRepository.saveAll(readPermissions.stream()
                    .map(permission -> new StaffPermission(admin, permission, now))
                    .toList());
            recordChange(schoolId, admin, List.of(), readPermissions, caller, now);
            migrated++;
        }
        log.info("Permission migration school={} migrated={} skipped={}", schoolId, migrated, skipped);
        return new MigrationResult(migrated, skipped);
    }

    private void authorizeGrantor(
            UUID schoolId,
            SchoolAdmin target,
            Iterable<Permission> requested,
            CallerContext caller
    ) {
        SchoolAdmin callerAdmin = schoolAdminRepository.findByUserIdAndSchoolId(caller.userId(), schoolId)
                .orElseThrow(() -> deny(caller, schoolId, target, "tenant.forbidden",
                        "You do not have access to this school"));

        ActorGrants callerGrants = loadActorGrants(callerAdmin);
        if (callerGrants.fullAccess()) {
            return;
        }
        if (!PermissionEvaluator.hasAdminAccess(callerGrants, PermissionResource.STAFF)) {
            throw deny(caller, schoolId, target, "permission.forbidden",
                    "You need STAFF:ADMIN permission to modify other administrators' permissions");
        }
        for (Permission permission : requested) {
            if (permission.getType() == PermissionType.ADMIN
                    && !PermissionEvaluator.hasAdminAccess(callerGrants, permission.getResource())) {
                throw deny(caller, schoolId, target, "permission.forbidden",
                        "You cannot assign " + permission.getResource() + ":ADMIN permission as you don't have it yourself");
            }
        }
    }

    private ProblemException deny(CallerContext caller, UUID schoolId, SchoolAdmin target, String code, String detail) {
        log.warn("Permission change denied caller={} ip={} school={} target={} reason={}",
                caller.userId(), caller.ipAddress(), schoolId, target.getId(), detail);
        return ProblemException.forbidden(code, detail);
    }

    private void recordChange(
            UUID schoolId,
            SchoolAdmin target,
            List<Permission> previous,
            List<Permission> current,
            CallerContext caller,
            OffsetDateTime occurredAt
    ) {
        Set<UUID> previousIds = previous.stream().map(Permission::getId).collect(Collectors.toCollection(LinkedHashSet::new));
        Set<UUID> currentIds = current.stream().map(Permission::getId).collect(Collectors.toCollection(LinkedHashSet::new));
        List<UUID> added = currentIds.stream().filter(id -> !previousIds.contains(id)).sorted().toList();
        List<UUID> removed = previousIds.stream().filter(id -> !currentIds.contains(id)).sorted().toList();

        auditLogService.recordPermissionChange(new PermissionChangeAuditEvent(
                occurredAt,
                schoolId,
                target.getId(),
                target.getFullName(),
                target.getRole(),
                caller != null ? caller.userId() : null,
                caller != null && caller.ipAddress() != null ? caller.ipAddress() : "unknown",
                previousIds.size(),
                currentIds.size(),
                added,
                removed
        ));
    }

    private SchoolAdmin findAdmin(UUID schoolId, UUID adminId) {
        return schoolAdminRepository.findByIdAndSchoolId(adminId, schoolId)
                .orElseThrow(() -> ProblemException.notFound("staff.admin_not_found", "Admin not found"));
    }

    private List<Permission> loadPermissions(UUID adminId) {
        return staffPermissionRepository.findByAdminIdWithPermission(adminId).stream()
                .map(StaffPermission::getPermission)
                .sorted(PermissionCatalogService.CATALOG_ORDER)
                .toList();
    }

    private StaffPermissionsView toView(SchoolAdmin admin, List<Permission> permissions) {
        return new StaffPermissionsView(
                admin.getId(),
                admin.getFullName(),
                admin.getRole(),
                admin.isFullAccess(),
                permissions.stream()
                        .sorted(PermissionCatalogService.CATALOG_ORDER)
                        .map(PermissionView::from)
                        .toList()
        );
    }
}
