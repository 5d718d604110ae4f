package org.filest.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * {@code /api/**} 的 HTTP Basic 认证过滤器（WebSocket 上传 {@code /api/ws/**} 在协议内自行认证，不经过这里）。
 * <p>
 * 没有带 Authorization 头时返回 401 + {@code WWW-Authenticate}；带了但不正确时只返回 401，
 * 不带 {@code WWW-Authenticate}，避免浏览器弹出自带的登录框（前端自己处理认证失败）。
 */
public class BasicAuthFilter extends OncePerRequestFilter {

    static final String CHALLENGE = "Basic realm=\"File Manager\", charset=\"UTF-8\"";
    private static final String BASIC_PREFIX = "Basic ";

    private final CredentialVerifier verifier;

    public BasicAuthFilter(CredentialVerifier verifier) {
        this.verifier = verifier;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !path.startsWith("/api/") || path.startsWith("/api/ws/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BASIC_PREFIX)
                && verifier.verifyEncoded(header.substring(BASIC_PREFIX.length()))) {
            chain.doFilter(request, response);
            return;
        }

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        if (header == null) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, CHALLENGE);
        }
        response.setContentType(MediaType.TEXT_PLAIN_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write("Unauthorized");
    }
}
