package com.auditq.api;

import com.auditq.config.AuditQProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the cron-invoked processing endpoints with a shared token. Without a configured token the
 * endpoints stay closed.
 */
public class InternalEndpointInterceptor implements HandlerInterceptor {

    public static final String TOKEN_HEADER = "X-AuditQ-Internal-Token";
    private static final Logger log = LoggerFactory.getLogger(InternalEndpointInterceptor.class);

    private final AuditQProperties properties;

    public InternalEndpointInterceptor(AuditQProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String expected = properties.getApi().getInternalToken();
        if (expected == null || expected.isBlank()) {
            log.warn("Rejected call to {}: auditq.api.internal-token is not configured", request.getRequestURI());
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            return false;
        }
        String presented = request.getHeader(TOKEN_HEADER);
        if (presented != null && MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8))) {
            return true;
        }
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        return false;
    }
}
