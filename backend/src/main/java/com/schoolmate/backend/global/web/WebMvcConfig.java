package com.schoolmate.backend.global.web;

import java.util.List;

import com.schoolmate.backend.modules.permission.presentation.PermissionInterceptor;
import com.schoolmate.backend.modules.tenant.presentation.SchoolContextArgumentResolver;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final PermissionInterceptor permissionInterceptor;
    private final SchoolContextArgumentResolver schoolContextArgumentResolver;

    public WebMvcConfig(PermissionInterceptor permissionInterceptor,
                        SchoolContextArgumentResolver schoolContextArgumentResolver) {
        this.permissionInterceptor = permissionInterceptor;
        this.schoolContextArgumentResolver = schoolContextArgumentResolver;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(permissionInterceptor).addPathPatterns("/schools/**");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(schoolContextArgumentResolver);
    }
}
