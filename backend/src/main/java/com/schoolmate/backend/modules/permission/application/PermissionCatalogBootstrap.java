package com.schoolmate.backend.modules.permission.application;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Seeds the permission catalog once the application is ready.
 */
@Component
@ConditionalOnProperty(value = "schoolmate.permissions.bootstrap-on-startup", havingValue = "true", matchIfMissing = true)
public class PermissionCatalogBootstrap {

    private final PermissionCatalogService permissionCatalogService;

    public PermissionCatalogBootstrap(PermissionCatalogService permissionCatalogService) {
        this.permissionCatalogService = permissionCatalogService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seedCatalog() {
        permissionCatalogService.initialize();
    }
}
