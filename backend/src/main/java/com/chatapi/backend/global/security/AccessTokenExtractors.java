package com.chatapi.backend.global.security;

import java.util.Optional;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.util.WebUtils;

public final class AccessTokenExtractors {

    private static final String BEARER_PREFIX = "Bearer ";

    private AccessTokenExtractors() {
    }

    /**
     * {@code Authorization: Bearer <token>}. Other schemes are ignored.
     */
    public static AccessTokenExtractor bearerHeader() {
        return request -> {
            String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
            if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
                return Optional.empty();
            }
            return nonBlank(authorization.substring(BEARER_PREFIX.length()));
        };
    }

    public static AccessTokenExtractor cookie(String name) {
        return request -> {
            Cookie cookie = WebUtils.getCookie(request, name);
            return cookie == null ? Optional.empty() : nonBlank(cookie.getValue());
        };
    }

    /**
     * Handshake-time token passed as a query parameter. A leading {@code Bearer } is tolerated.
     */
    public static AccessTokenExtractor queryParameter(String name) {
        return request -> nonBlank(stripBearer(request.getParameter(name)));
    }

    static String stripBearer(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return trimmed.substring(BEARER_PREFIX.length());
        }
        return trimmed;
    }

    private static Optional<String> nonBlank(String value) {
        return StringUtils.hasText(value) ? Optional.of(value.trim()) : Optional.empty();
    }
}
