package com.schoolmate.backend.modules.permission.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.schoolmate.backend.global.error.ProblemException;
import com.schoolmate.backend.global.error.ProblemKind;
import com.schoolmate.backend.modules.audit.application.AuditLogService;
import com.schoolmate.backend.modules.audit.domain.PermissionChangeAuditEvent;
import com.schoolmate.backend.modules.permission.domain.Permission;
import com.schoolmate.backend.modules.permission.domain.PermissionKey;
import com.schoolmate.backend.modules.permission.domain.PermissionResource;
import com.schoolmate.backend.modules.permission.domain.PermissionType;
import com.schoolmate.backend.modules.permission.domain.StaffPermission;
import com.schoolmate.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.schoolmate.backend.modules.permission.infrastructure.persistence.StaffPermissionRepository;
import com.schoolmate.backend.modules.staff.domain.SchoolAdmin;
import com.schoolmate.backend.modules.staff.infrastructure.persistence.SchoolAdminRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class PermissionGrantServiceTest {

    private static final Instant FIXED_NOW = Instant.parse("2025-03-01T09:00:00Z");
    private static final UUID SCHOOL_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID OTHER_SCHOOL_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b2");

    @Mock
    private SchoolAdminRepository schoolAdminRepository;

    @Mock
    private PermissionRepository permissionRepository;

    @Mock
    private StaffPermissionRepository staffPermissionRepository;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private PermissionGrantService service;

    private final Map<PermissionKey, Permission> catalog = new HashMap<>();
    private final Map<UUID, List<StaffPermission>> grantTable = new HashMap<>();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
        service = new PermissionGrantService(
                schoolAdminRepository,
                permissionRepository,
                staffPermissionRepository,
                auditLogService,
                eventPublisher,
                clock
        );
        for (PermissionResource resource : PermissionResource.values()) {
            for (PermissionType type : PermissionType.values()) {
                PermissionKey key = PermissionKey.of(resource, type);
                catalog.put(key, new Permission(UUID.randomUUID(), resource, type, key.description()));
            }
        }
        lenient().when(permissionRepository.findAllById(anyIterable())).thenAnswer(invocation -> {
            List<UUID> ids = new ArrayList<>();
            invocation.<Iterable<UUID>>getArgument(0).forEach(ids::add);
            return catalog.values().stream().filter(p -> ids.contains(p.getId())).toList();
        });
        lenient().when(staffPermissionRepository.findByAdminIdWithPermission(any()))
                .thenAnswer(invocation -> grantTable.getOrDefault(invocation.<UUID>getArgument(0), List.of()));
    }

    @Test
    void principalGrantsAreReportedEmptyAndNeverLookedUp() {
        SchoolAdmin principal = admin(SCHOOL_ID, "Principal", true);
        when(schoolAdminRepository.findByIdAndSchoolId(principal.getId(), SCHOOL_ID)).thenReturn(Optional.of(principal));

        StaffPermissionsView view = service.getGrantsFor(SCHOOL_ID, principal.getId());

        assertThat(view.fullAccess()).isTrue();
        assertThat(view.permissions()).isEmpty();
        verify(staffPermissionRepository, never()).findByAdminIdWithPermission(any());
    }

    @Test
    void hasPermissionReflectsStoredGrantsWithAdminImplication() {
        SchoolAdmin teacher = admin(SCHOOL_ID, "Teacher", false);
        grant(teacher, key(PermissionResource.STUDENTS, PermissionType.ADMIN));
        when(schoolAdminRepository.findByIdAndSchoolId(teacher.getId(), SCHOOL_ID)).thenReturn(Optional.of(teacher));

        assertThat(service.hasPermission(SCHOOL_ID, teacher.getId(), PermissionResource.STUDENTS, PermissionType.WRITE)).isTrue();
        assertThat(service.hasPermission(SCHOOL_ID, teacher.getId(), PermissionResource.CLASSES, PermissionType.READ)).isFalse();
        assertThat(service.hasAdminPermission(SCHOOL_ID, teacher.getId(), PermissionResource.STUDENTS)).isTrue();
    }

    @Test
    void adminFromAnotherSchoolIsNotFound() {
        SchoolAdmin foreign = admin(OTHER_SCHOOL_ID, "Teacher", false);
        when(schoolAdminRepository.findByIdAndSchoolId(foreign.getId(), SCHOOL_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getGrantsFor(SCHOOL_ID, foreign.getId()))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ProblemKind.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("staff.admin_not_found");
                });
    }

    @Test
    void assignmentReplacesWholeGrantSetAndAuditsTheDifference() {
        SchoolAdmin principal = admin(SCHOOL_ID, "Principal", true);
        SchoolAdmin target = admin(SCHOOL_ID, "Teacher", false);
        Permission oldGrant = key(PermissionResource.CALENDAR, PermissionType.READ);
        grant(target, oldGrant);
        stubTarget(target);
        stubCaller(principal);

        Permission studentsRead = key(PermissionResource.STUDENTS, PermissionType.READ);
        Permission classesWrite = key(PermissionResource.CLASSES, PermissionType.WRITE);

        StaffPermissionsView view = service.assignPermissions(SCHOOL_ID, target.getId(),
                List.of(studentsRead.getId(), classesWrite.getId(), studentsRead.getId()),
                callerFor(principal));

        assertThat(view.permissions()).extracting(PermissionView::id)
                .containsExactly(studentsRead.getId(), classesWrite.getId());
        verify(staffPermissionRepository).deleteByAdminId(target.getId());

        ArgumentCaptor<List<StaffPermission>> saved = listCaptor();
        verify(staffPermissionRepository).saveAll(saved.capture());
        assertThat(saved.getValue()).extracting(StaffPermission::getPermission)
                .containsExactlyInAnyOrder(studentsRead, classesWrite);

        ArgumentCaptor<PermissionChangeAuditEvent> audit = ArgumentCaptor.forClass(PermissionChangeAuditEvent.class);
        verify(auditLogService).recordPermissionChange(audit.capture());
        assertThat(audit.getValue().previousPermissionCount()).isEqualTo(1);
        assertThat(audit.getValue().newPermissionCount()).isEqualTo(2);
        assertThat(audit.getValue().removedPermissionIds()).containsExactly(oldGrant.getId());
        assertThat(audit.getValue().addedPermissionIds())
                .containsExactlyInAnyOrder(studentsRead.getId(), classesWrite.getId());
        assertThat(audit.getValue().callerUserId()).isEqualTo(principal.getUserId());
        assertThat(audit.getValue().callerIp()).isEqualTo("203.0.113.9");

        ArgumentCaptor<PermissionsChangedEvent> event = ArgumentCaptor.forClass(PermissionsChangedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().adminId()).isEqualTo(target.getId());
        assertThat(event.getValue().permissions()).hasSize(2);
    }

    @Test
    void emptyListRevokesEverything() {
        SchoolAdmin principal = admin(SCHOOL_ID, "Principal", true);
        SchoolAdmin target = admin(SCHOOL_ID, "Teacher", false);
        grant(target, key(PermissionResource.GRADES, PermissionType.READ));
        stubTarget(target);
        stubCaller(principal);

        StaffPermissionsView view = service.assignPermissions(SCHOOL_ID, target.getId(), List.of(), callerFor(principal));

        assertThat(view.permissions()).isEmpty();
        verify(staffPermissionRepository).deleteByAdminId(target.getId());
    }

    @Test
    void principalTargetIsImmutable() {
        SchoolAdmin principalTarget = admin(SCHOOL_ID, "Principal", true);
        stubTarget(principalTarget);

        assertThatThrownBy(() -> service.assignPermissions(SCHOOL_ID, principalTarget.getId(),
                List.of(key(PermissionResource.STAFF, PermissionType.READ).getId()), CallerContext.system()))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ProblemKind.INVALID_OPERATION);
                    assertThat(ex.getCode()).isEqualTo("permission.principal_immutable");
                });
        verify(staffPermissionRepository, never()).deleteByAdminId(any());
        verifyNoInteractions(auditLogService, eventPublisher);
    }

    @Test
    void unknownIdsRejectTheWholeRequestWithoutWrites() {
        SchoolAdmin target = admin(SCHOOL_ID, "Teacher", false);
        stubTarget(target);
        UUID bogus = UUID.randomUUID();

        assertThatThrownBy(() -> service.assignPermissions(SCHOOL_ID, target.getId(),
                List.of(key(PermissionResource.STAFF, PermissionType.READ).getId(), bogus), CallerContext.system()))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ProblemKind.INVALID_INPUT);
                    assertThat(ex.getCode()).isEqualTo("permission.unknown_ids");
                    assertThat(ex.getDetailMessage()).contains(bogus.toString());
                });
        verify(staffPermissionRepository, never()).deleteByAdminId(any());
        verify(staffPermissionRepository, never()).saveAll(anyIterable());
    }

    @Test
    void nullIdListIsInvalidInput() {
        assertThatThrownBy(() -> service.assignPermissions(SCHOOL_ID, UUID.randomUUID(), null, CallerContext.system()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("permission.invalid_ids"));

        assertThatThrownBy(() -> service.assignPermissions(SCHOOL_ID, UUID.randomUUID(),
                Arrays.asList(UUID.randomUUID(), null), CallerContext.system()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("permission.invalid_ids"));
        verifyNoInteractions(schoolAdminRepository);
    }

    @Test
    void unmodifiableIdListsAreAccepted() {
        SchoolAdmin target = admin(SCHOOL_ID, "Librarian", false);
        stubTarget(target);
        List<UUID> ids = List.copyOf(List.of(
                key(PermissionResource.STUDENTS, PermissionType.READ).getId(),
                key(PermissionResource.CLASSES, PermissionType.WRITE).getId()));

        StaffPermissionsView view = service.assignPermissions(SCHOOL_ID, target.getId(), ids, CallerContext.system());

        assertThat(view.permissions()).hasSize(2);
        verify(staffPermissionRepository).deleteByAdminId(target.getId());
        verify(staffPermissionRepository).saveAll(anyIterable());
    }

    @Test
    void targetOutsideCallerSchoolIsNotFound() {
        UUID foreignAdminId = UUID.randomUUID();
        when(schoolAdminRepository.findByIdAndSchoolIdForUpdate(foreignAdminId, SCHOOL_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.assignPermissions(SCHOOL_ID, foreignAdminId, List.of(), CallerContext.system()))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ProblemKind.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("staff.admin_not_found");
                });
        verify(staffPermissionRepository, never()).deleteByAdminId(any());
    }

    @Test
    void staffAdminCannotGrantAdminRightsTheyLack() {
        SchoolAdmin grantor = admin(SCHOOL_ID, "Deputy", false);
        grant(grantor,
                key(PermissionResource.STAFF, PermissionType.ADMIN),
                key(PermissionResource.STUDENTS, PermissionType.ADMIN));
        SchoolAdmin target = admin(SCHOOL_ID, "Teacher", false);
        stubTarget(target);
        stubCaller(grantor);

        assertThatThrownBy(() -> service.assignPermissions(SCHOOL_ID, target.getId(),
                List.of(key(PermissionResource.GRADES, PermissionType.ADMIN).getId()), callerFor(grantor)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ProblemKind.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("permission.forbidden");
                    assertThat(ex.getDetailMessage()).contains("GRADES:ADMIN");
                });
        verify(staffPermissionRepository, never()).deleteByAdminId(any());
        verifyNoInteractions(auditLogService, eventPublisher);
    }

    @Test
    void staffAdminMayPassOnAdminRightsTheyHoldAndAnyReadOrWrite() {
        SchoolAdmin grantor = admin(SCHOOL_ID, "Deputy", false);
        grant(grantor,
                key(PermissionResource.STAFF, PermissionType.ADMIN),
                key(PermissionResource.STUDENTS, PermissionType.ADMIN));
        SchoolAdmin target = admin(SCHOOL_ID, "Teacher", false);
        stubTarget(target);
        stubCaller(grantor);

        StaffPermissionsView view = service.assignPermissions(SCHOOL_ID, target.getId(), List.of(
                key(PermissionResource.STUDENTS, PermissionType.ADMIN).getId(),
                key(PermissionResource.GRADES, PermissionType.WRITE).getId()
        ), callerFor(grantor));

        assertThat(view.permissions()).hasSize(2);
    }

    @Test
    void callerWithoutStaffAdminIsForbidden() {
        SchoolAdmin grantor = admin(SCHOOL_ID, "Teacher", false);
        grant(grantor, key(PermissionResource.STAFF, PermissionType.WRITE));
        SchoolAdmin target = admin(SCHOOL_ID, "Teacher", false);
        stubTarget(target);
        stubCaller(grantor);

        assertThatThrownBy(() -> service.assignPermissions(SCHOOL_ID, target.getId(),
                List.of(key(PermissionResource.STAFF, PermissionType.READ).getId()), callerFor(grantor)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("permission.forbidden"));
    }

    @Test
    void callerWithoutMembershipInSchoolIsTenantForbidden() {
        SchoolAdmin target = admin(SCHOOL_ID, "Teacher", false);
        stubTarget(target);
        UUID outsiderUserId = UUID.randomUUID();
        when(schoolAdminRepository.findByUserIdAndSchoolId(outsiderUserId, SCHOOL_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.assignPermissions(SCHOOL_ID, target.getId(), List.of(),
                new CallerContext(outsiderUserId, false, "198.51.100.4")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ProblemKind.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("tenant.forbidden");
                });
    }

    @Test
    void systemCallerIsAuditedAsSystemWithUnknownIp() {
        SchoolAdmin target = admin(SCHOOL_ID, "Teacher", false);
        stubTarget(target);

        service.assignPermissions(SCHOOL_ID, target.getId(),
                List.of(key(PermissionResource.OVERVIEW, PermissionType.READ).getId()), null);

        ArgumentCaptor<PermissionChangeAuditEvent> audit = ArgumentCaptor.forClass(PermissionChangeAuditEvent.class);
        verify(auditLogService).recordPermissionChange(audit.capture());
        assertThat(audit.getValue().callerLabel()).isEqualTo(PermissionChangeAuditEvent.SYSTEM_CALLER);
        assertThat(audit.getValue().callerIp()).isEqualTo("unknown");
    }

    @Test
    void migrationGivesReadToStaffWithoutGrantsAndSkipsTheRest() {
        SchoolAdmin principal = admin(SCHOOL_ID, "Principal", true);
        SchoolAdmin fresh = admin(SCHOOL_ID, "Teacher", false);
        SchoolAdmin configured = admin(SCHOOL_ID, "Bursar", false);
        List<Permission> reads = catalog.values().stream().filter(p -> p.getType() == PermissionType.READ).toList();
        when(permissionRepository.findByType(PermissionType.READ)).thenReturn(reads);
        when(staffPermissionRepository.findAdminIdsWithGrants(SCHOOL_ID)).thenReturn(List.of(configured.getId()));
        when(schoolAdminRepository.findBySchoolIdOrderByCreatedAtAsc(SCHOOL_ID))
                .thenReturn(List.of(principal, fresh, configured));

        MigrationResult result = service.migrateExistingAdmins(SCHOOL_ID, CallerContext.system());

        assertThat(result.migrated()).isEqualTo(1);
        assertThat(result.skipped()).isEqualTo(2);
        ArgumentCaptor<List<StaffPermission>> saved = listCaptor();
        verify(staffPermissionRepository).saveAll(saved.capture());
        assertThat(saved.getValue()).hasSize(PermissionResource.values().length)
                .allSatisfy(row -> assertThat(row.getAdmin()).isSameAs(fresh));
        verify(auditLogService).recordPermissionChange(any());
    }

    @Test
    void migrationRequiresAnInitializedCatalog() {
        when(permissionRepository.findByType(PermissionType.READ)).thenReturn(List.of());

        assertThatThrownBy(() -> service.migrateExistingAdmins(SCHOOL_ID, CallerContext.system()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("permission.catalog_empty"));
    }

    private Permission key(PermissionResource resource, PermissionType type) {
        return catalog.get(PermissionKey.of(resource, type));
    }

    private void grant(SchoolAdmin admin, Permission... permissions) {
        OffsetDateTime now = OffsetDateTime.ofInstant(FIXED_NOW, ZoneOffset.UTC);
        grantTable.put(admin.getId(), Arrays.stream(permissions)
                .map(permission -> new StaffPermission(admin, permission, now))
                .toList());
    }

    private void stubTarget(SchoolAdmin target) {
        when(schoolAdminRepository.findByIdAndSchoolIdForUpdate(target.getId(), target.getSchoolId()))
                .thenReturn(Optional.of(target));
    }

    private void stubCaller(SchoolAdmin caller) {
        when(schoolAdminRepository.findByUserIdAndSchoolId(caller.getUserId(), caller.getSchoolId()))
                .thenReturn(Optional.of(caller));
    }

    private static CallerContext callerFor(SchoolAdmin admin) {
        return new CallerContext(admin.getUserId(), false, "203.0.113.9");
    }

    private static SchoolAdmin admin(UUID schoolId, String role, boolean fullAccess) {
        SchoolAdmin admin = new SchoolAdmin(schoolId, UUID.randomUUID(), role, fullAccess);
        admin.setFirstName("Test");
        admin.setLastName(role);
        ReflectionTestUtils.setField(admin, "id", UUID.randomUUID());
        return admin;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static ArgumentCaptor<List<StaffPermission>> listCaptor() {
        return (ArgumentCaptor) ArgumentCaptor.forClass(List.class);
    }
}
