package com.schoolmate.backend.modules.permission.application;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.schoolmate.backend.modules.permission.domain.Permission;
import com.schoolmate.backend.modules.permission.domain.PermissionKey;
import com.schoolmate.backend.modules.permission.domain.PermissionResource;
import com.schoolmate.backend.modules.permission.domain.PermissionType;
import com.schoolmate.backend.modules.permission.infrastructure.persistence.PermissionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PermissionCatalogService {

    private static final Logger log = LoggerFactory.getLogger(PermissionCatalogService.class);

    static final Comparator<Permission> CATALOG_ORDER = Comparator
            .comparing(Permission::getResource)
            .thenComparing(Permission::getType);

    private final PermissionRepository permissionRepository;

    public PermissionCatalogService(PermissionRepository permissionRepository) {
        this.permissionRepository = permissionRepository;
    }

    /**
     * Ensures every resource/type pair exists. Safe to run on every start and from several
     * instances at once.
     *
     * @return number of rows inserted by this call
     */
    @Transactional
    public int initialize() {
        return initialize(EnumSet.allOf(PermissionResource.class));
    }

    @Transactional
    public int initialize(Set<PermissionResource> resources) {
        int inserted = 0;
        for (PermissionResource resource : resources) {
            for (PermissionType type : PermissionType.values()) {
                PermissionKey key = PermissionKey.of(resource, type);
                inserted += permissionRepository.insertIfAbsent(
                        UUID.randomUUID(),
                        resource.name(),
                        type.name(),
                        key.description()
                );
            }
        }
        if (inserted > 0) {
            log.info("Permission catalog initialized: inserted={} resources={}", inserted, resources.size());
        } else {
            log.debug("Permission catalog already complete for {} resources", resources.size());
        }
        return inserted;
    }

    @Transactional(readOnly = true)
    public List<Permission> listAll() {
        return permissionRepository.findAll().stream()
                .sorted(CATALOG_ORDER)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Permission> listByType(PermissionType type) {
        return permissionRepository.findByType(type).stream()
                .sorted(CATALOG_ORDER)
                .toList();
    }
}
