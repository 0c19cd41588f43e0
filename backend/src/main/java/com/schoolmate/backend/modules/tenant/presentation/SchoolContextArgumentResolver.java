package com.schoolmate.backend.modules.tenant.presentation;

import com.schoolmate.backend.modules.tenant.domain.SchoolContext;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Lets controller methods declare a {@link SchoolContext} parameter.
 */
@Component
public class SchoolContextArgumentResolver implements HandlerMethodArgumentResolver {

    private final SchoolContextRequestResolver requestResolver;

    public SchoolContextArgumentResolver(SchoolContextRequestResolver requestResolver) {
        this.requestResolver = requestResolver;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return SchoolContext.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        if (request == null) {
            throw new IllegalStateException("SchoolContext is only available for servlet requests");
        }
        return requestResolver.resolve(request);
    }
}
