package com.chatapi.backend.global.security;

import com.chatapi.backend.global.error.ProblemException;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.WebUtils;

/**
 * {@code /auth/refresh} 전용. 리프레시 토큰은 쿠키로만 받는다. 유효성 판단은 세션 서비스가 한다.
 */
@Component
public class RefreshTokenGuard {

    static final String MISSING_REFRESH_TOKEN = "MISSING_REFRESH_TOKEN";

    public String requireRefreshToken(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, AuthCookies.REFRESH_TOKEN_COOKIE);
        if (cookie == null || !StringUtils.hasText(cookie.getValue())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, MISSING_REFRESH_TOKEN);
        }
        return cookie.getValue().trim();
    }

    public String findRefreshToken(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, AuthCookies.REFRESH_TOKEN_COOKIE);
        return cookie != null && StringUtils.hasText(cookie.getValue()) ? cookie.getValue().trim() : null;
    }
}
