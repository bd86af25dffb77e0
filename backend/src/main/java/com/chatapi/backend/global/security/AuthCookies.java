package com.chatapi.backend.global.security;

import java.time.Duration;

import com.chatapi.backend.modules.auth.application.AuthenticatedSession;

import jakarta.servlet.http.HttpServletResponse;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * 액세스/리프레시 토큰 쿠키 발급과 삭제.
 * 두 쿠키 모두 HttpOnly, SameSite=Strict 이며 리프레시 쿠키는 {@code /auth} 경로로만 전송된다.
 */
@Component
public class AuthCookies {

    public static final String ACCESS_TOKEN_COOKIE = "jwt";
    public static final String REFRESH_TOKEN_COOKIE = "refresh_token";
    static final String ACCESS_TOKEN_PATH = "/";
    static final String REFRESH_TOKEN_PATH = "/auth";
    private static final String SAME_SITE = "Strict";

    private final boolean secure;
    private final Duration accessTokenMaxAge;
    private final Duration refreshTokenMaxAge;

    public AuthCookies(
            @Value("${app.auth.cookie.secure:false}") boolean secure,
            @Value("${jwt.expiration:3600000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:2592000000}") long refreshTokenTtlMillis
    ) {
        this.secure = secure;
        this.accessTokenMaxAge = Duration.ofMillis(accessTokenTtlMillis);
        this.refreshTokenMaxAge = Duration.ofMillis(refreshTokenTtlMillis);
    }

    public void write(HttpServletResponse response, AuthenticatedSession session) {
        addCookie(response, ACCESS_TOKEN_COOKIE, session.accessToken(), ACCESS_TOKEN_PATH, accessTokenMaxAge);
        addCookie(response, REFRESH_TOKEN_COOKIE, session.refreshToken(), REFRESH_TOKEN_PATH, refreshTokenMaxAge);
    }

    public void clear(HttpServletResponse response) {
        addCookie(response, ACCESS_TOKEN_COOKIE, "", ACCESS_TOKEN_PATH, Duration.ZERO);
        addCookie(response, REFRESH_TOKEN_COOKIE, "", REFRESH_TOKEN_PATH, Duration.ZERO);
    }

    private void addCookie(HttpServletResponse response, String name, String value, String path, Duration maxAge) {
        ResponseCookie cookie = ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite(SAME_SITE)
                .path(path)
                .maxAge(maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
