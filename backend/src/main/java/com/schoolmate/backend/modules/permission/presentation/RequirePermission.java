package com.schoolmate.backend.modules.permission.presentation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.schoolmate.backend.modules.permission.domain.PermissionResource;
import com.schoolmate.backend.modules.permission.domain.PermissionType;

/**
 * Requires the caller to hold {@code resource:type} in the request's school before the handler runs.
 * A method-level annotation overrides one on the controller class.
 */
@Documented
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface RequirePermission {

    PermissionResource resource();

    PermissionType type();
}
