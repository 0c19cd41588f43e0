package com.schoolmate.backend.modules.permission.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.Test;

class PermissionEvaluatorTest {

    @Test
    void principalIsAllowedEverything() {
        ActorGrants principal = ActorGrants.principal(UUID.randomUUID(), "Principal");

        for (PermissionResource resource : PermissionResource.values()) {
            for (PermissionType type : PermissionType.values()) {
                assertThat(PermissionEvaluator.hasPermission(principal, resource, type)).isTrue();
            }
            assertThat(PermissionEvaluator.hasAdminAccess(principal, resource)).isTrue();
        }
    }

    @Test
    void adminGrantImpliesReadAndWriteOnSameResourceOnly() {
        ActorGrants actor = grants(PermissionKey.of(PermissionResource.STUDENTS, PermissionType.ADMIN));

        assertThat(PermissionEvaluator.hasPermission(actor, PermissionResource.STUDENTS, PermissionType.READ)).isTrue();
        assertThat(PermissionEvaluator.hasPermission(actor, PermissionResource.STUDENTS, PermissionType.WRITE)).isTrue();
        assertThat(PermissionEvaluator.hasPermission(actor, PermissionResource.STUDENTS, PermissionType.ADMIN)).isTrue();

        for (PermissionResource other : EnumSet.complementOf(EnumSet.of(PermissionResource.STUDENTS))) {
            for (PermissionType type : PermissionType.values()) {
                assertThat(PermissionEvaluator.hasPermission(actor, other, type)).isFalse();
            }
        }
    }

    @Test
    void writeDoesNotImplyRead() {
        ActorGrants actor = grants(PermissionKey.of(PermissionResource.GRADES, PermissionType.WRITE));

        assertThat(PermissionEvaluator.hasPermission(actor, PermissionResource.GRADES, PermissionType.WRITE)).isTrue();
        assertThat(PermissionEvaluator.hasPermission(actor, PermissionResource.GRADES, PermissionType.READ)).isFalse();
        assertThat(PermissionEvaluator.hasAdminAccess(actor, PermissionResource.GRADES)).isFalse();
    }

    @Test
    void readOnlyActorCannotWrite() {
        ActorGrants actor = grants(PermissionKey.of(PermissionResource.STUDENTS, PermissionType.READ));

        assertThat(PermissionEvaluator.hasPermission(actor, PermissionResource.STUDENTS, PermissionType.READ)).isTrue();
        assertThat(PermissionEvaluator.hasPermission(actor, PermissionResource.STUDENTS, PermissionType.WRITE)).isFalse();
    }

    @Test
    void missingActorIsDenied() {
        assertThat(PermissionEvaluator.hasPermission(null, PermissionResource.OVERVIEW, PermissionType.READ)).isFalse();
        assertThat(PermissionEvaluator.hasAdminAccess(null, PermissionResource.OVERVIEW)).isFalse();
    }

    @Test
    void principalSnapshotDropsExplicitGrants() {
        ActorGrants actor = new ActorGrants(UUID.randomUUID(), "Principal", true,
                Set.of(PermissionKey.of(PermissionResource.STAFF, PermissionType.READ)));

        assertThat(actor.grants()).isEmpty();
        assertThat(PermissionEvaluator.hasAdminAccess(actor, PermissionResource.STAFF)).isTrue();
    }

    private static ActorGrants grants(PermissionKey... keys) {
        return new ActorGrants(UUID.randomUUID(), "Teacher", false, Set.of(keys));
    }
}
