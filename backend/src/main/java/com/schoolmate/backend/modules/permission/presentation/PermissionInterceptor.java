package com.schoolmate.backend.modules.permission.presentation;

import com.schoolmate.backend.global.error.ProblemException;
import com.schoolmate.backend.modules.permission.application.PermissionGrantService;
import com.schoolmate.backend.modules.tenant.domain.SchoolContext;
import com.schoolmate.backend.modules.tenant.presentation.SchoolContextRequestResolver;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Enforces {@link RequirePermission}. Platform operators pass once the tenant is resolved; school
 * administrators are evaluated against their live grants.
 */
@Component
public class PermissionInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(PermissionInterceptor.class);

    private final SchoolContextRequestResolver schoolContextRequestResolver;
    private final PermissionGrantService permissionGrantService;

    public PermissionInterceptor(
            SchoolContextRequestResolver schoolContextRequestResolver,
            PermissionGrantService permissionGrantService
    ) {
        this.schoolContextRequestResolver = schoolContextRequestResolver;
        this.permissionGrantService = permissionGrantService;
    }

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        RequirePermission required = findRequirement(handlerMethod);
        if (required == null) {
            return true;
        }

        SchoolContext context = schoolContextRequestResolver.resolve(request);
        if (context.platformScope()) {
            return true;
        }

        boolean allowed = permissionGrantService.hasPermission(
                context.schoolId(), context.adminId(), required.resource(), required.type());
        if (!allowed) {
            log.warn("Permission denied user={} admin={} school={} required={}:{} path={}",
                    context.userId(), context.adminId(), context.schoolId(),
                    required.resource(), required.type(), request.getRequestURI());
            throw ProblemException.forbidden(
                    "permission.denied",
                    "You need " + required.resource() + ":" + required.type() + " permission to perform this action"
            );
        }
        return true;
    }

    private RequirePermission findRequirement(HandlerMethod handlerMethod) {
        RequirePermission onMethod = AnnotatedElementUtils.findMergedAnnotation(
                handlerMethod.getMethod(), RequirePermission.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), RequirePermission.class);
    }
}
