package com.talentforge.security;

import com.talentforge.exception.AdminAccessDeniedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Bearer-token gate for the dead-letter admin endpoints. With no token
 * configured the admin surface is closed.
 */
@Component
public class AdminAuthInterceptor implements HandlerInterceptor {

    private static final String BEARER = "Bearer ";

    private final String adminToken;

    public AdminAuthInterceptor(@Value("${webhooks.admin.token:}") String adminToken) {
        this.adminToken = adminToken;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (adminToken == null || adminToken.isBlank()) {
            throw new AdminAccessDeniedException("Admin token not configured");
        }

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER)) {
            throw new AdminAccessDeniedException("Missing bearer token");
        }

        if (!HmacSigner.constantTimeEquals(adminToken, header.substring(BEARER.length()).trim())) {
            throw new AdminAccessDeniedException("Invalid bearer token");
        }
        return true;
    }
}
