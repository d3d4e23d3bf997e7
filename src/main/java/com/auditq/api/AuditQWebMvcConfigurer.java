package com.auditq.api;

import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

public class AuditQWebMvcConfigurer implements WebMvcConfigurer {

    static final String[] INTERNAL_PATHS = {"/jobs/process", "/monitoring/process"};

    private final InternalEndpointInterceptor internalEndpointInterceptor;

    public AuditQWebMvcConfigurer(InternalEndpointInterceptor internalEndpointInterceptor) {
        this.internalEndpointInterceptor = internalEndpointInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(internalEndpointInterceptor).addPathPatterns(INTERNAL_PATHS);
    }
}
