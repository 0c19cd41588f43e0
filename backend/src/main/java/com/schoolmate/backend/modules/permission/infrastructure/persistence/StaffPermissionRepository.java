package com.schoolmate.backend.modules.permission.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.schoolmate.backend.modules.permission.domain.StaffPermission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StaffPermissionRepository extends JpaRepository<StaffPermission, UUID> {

    @Query("""
            select sp
              from StaffPermission sp
              join fetch sp.permission p
             where sp.admin.id = :adminId
            """)
    List<StaffPermission> findByAdminIdWithPermission(@Param("adminId") UUID adminId);

    @Modifying(flushAutomatically = true)
    @Query("delete from StaffPermission sp where sp.admin.id = :adminId")
    int deleteByAdminId(@Param("adminId") UUID adminId);

    @Query("""
            select distinct sp.admin.id
              from StaffPermission sp
             where sp.admin.schoolId = :schoolId
            """)
    List<UUID> findAdminIdsWithGrants(@Param("schoolId") UUID schoolId);
}
