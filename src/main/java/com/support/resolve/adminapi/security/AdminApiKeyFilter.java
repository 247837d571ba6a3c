package com.support.resolve.adminapi.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 後台 API 金鑰檢查 (Admin API Key Filter)
 * <p>
 * 受保護的請求：
 * 1. `/api/admin/**`：歷史紀錄、政策、配置與工具呼叫紀錄。
 * 2. `POST /api/support/tools/{name}`：直接呼叫工具（可寫入客戶歷史紀錄）。
 * <p>
 * `admin.api-key` 未設定時全部放行；設定後需帶相同的 X-Admin-Key 標頭，否則回 401。
 */
@Component
public class AdminApiKeyFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(AdminApiKeyFilter.class);

    static final String HEADER = "X-Admin-Key";

    private static final String ADMIN_PREFIX = "/api/admin";
    private static final String TOOL_INVOKE_PREFIX = "/api/support/tools/";

    @Value("${admin.api-key:}")
    private String adminApiKey;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        if (uri == null) {
            return true;
        }
        if (uri.startsWith(ADMIN_PREFIX)) {
            return false;
        }
        return !("POST".equalsIgnoreCase(request.getMethod()) && uri.startsWith(TOOL_INVOKE_PREFIX));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (adminApiKey == null || adminApiKey.isBlank() || matches(request.getHeader(HEADER))) {
            filterChain.doFilter(request, response);
            return;
        }

        logger.warn("拒絕未授權的請求: {} {}", request.getMethod(), request.getRequestURI());
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json;charset=UTF-8");
        response.getWriter().write("{\"success\":false,\"message\":\"Unauthorized\"}");
    }

    private boolean matches(String key) {
        return key != null && MessageDigest.isEqual(
                key.getBytes(StandardCharsets.UTF_8), adminApiKey.getBytes(StandardCharsets.UTF_8));
    }
}
