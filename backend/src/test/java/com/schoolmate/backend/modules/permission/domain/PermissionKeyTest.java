package com.schoolmate.backend.modules.permission.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PermissionKeyTest {

    @Test
    void describesAccessInCatalogFormat() {
        PermissionKey key = PermissionKey.of(PermissionResource.TRANSFERS, PermissionType.WRITE);

        assertThat(key.description()).isEqualTo("Write access to Student Transfers");
        assertThat(key).hasToString("TRANSFERS:WRITE");
    }
}
