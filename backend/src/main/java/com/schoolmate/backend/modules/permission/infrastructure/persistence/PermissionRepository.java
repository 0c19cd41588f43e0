package com.schoolmate.backend.modules.permission.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.schoolmate.backend.modules.permission.domain.Permission;
import com.schoolmate.backend.modules.permission.domain.PermissionType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PermissionRepository extends JpaRepository<Permission, UUID> {

    List<Permission> findByType(PermissionType type);

    /**
     * Inserts a catalog row unless one already exists for the (resource, type) pair.
     * Existing descriptions are left untouched.
     *
     * @return 1 when a row was inserted, 0 when it already existed
     */
    @Modifying
    @Query(value = """
            insert into permission (id, resource, type, description)
            values (:id, :resource, :type, :description)
            on conflict (resource, type) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("resource") String resource,
                       @Param("type") String type,
                       @Param("description") String description);
}
