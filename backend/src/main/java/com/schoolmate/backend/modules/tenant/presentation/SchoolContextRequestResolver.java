package com.schoolmate.backend.modules.tenant.presentation;

import com.schoolmate.backend.global.security.SecurityUtils;
import com.schoolmate.backend.modules.tenant.application.TenantResolver;
import com.schoolmate.backend.modules.tenant.domain.SchoolContext;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves the {@link SchoolContext} once per request and caches it as a request attribute.
 */
@Component
public class SchoolContextRequestResolver {

    static final String REQUEST_ATTRIBUTE = SchoolContext.class.getName();

    private final TenantResolver tenantResolver;
    private final String tenantBaseDomain;

    public SchoolContextRequestResolver(
            TenantResolver tenantResolver,
            @Value("${schoolmate.tenant.base-domain:}") String tenantBaseDomain
    ) {
        this.tenantResolver = tenantResolver;
        this.tenantBaseDomain = tenantBaseDomain;
    }

    public SchoolContext resolve(HttpServletRequest request) {
        Object cached = request.getAttribute(REQUEST_ATTRIBUTE);
        if (cached instanceof SchoolContext context) {
            return context;
        }
        SchoolContext context = tenantResolver.resolve(
                SecurityUtils.getCurrentPrincipal(),
                TenantHintExtractor.extract(request, tenantBaseDomain)
        );
        request.setAttribute(REQUEST_ATTRIBUTE, context);
        return context;
    }
}
