package com.chatapi.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authorization 헤더, 없으면 {@code jwt} 쿠키에서 액세스 토큰을 읽어 SecurityContext 를 채운다.
 * 토큰이 유효하지 않으면 익명으로 통과시키고, 보호된 경로는 entry point 가 401 로 막는다.
 */
@Component
public class AccessTokenAuthenticationFilter extends OncePerRequestFilter {

    private static final List<String> SKIPPED_PATH_PREFIXES = List.of("/health", "/readyz", "/actuator", "/ws/");

    private final AccessTokenAuthenticator accessTokenAuthenticator;
    private final AccessTokenExtractor tokenExtractor;

    public AccessTokenAuthenticationFilter(AccessTokenAuthenticator accessTokenAuthenticator) {
        this.accessTokenAuthenticator = accessTokenAuthenticator;
        this.tokenExtractor = AccessTokenExtractors.bearerHeader()
                .orElse(AccessTokenExtractors.cookie(AuthCookies.ACCESS_TOKEN_COOKIE));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Optional<String> token = tokenExtractor.extract(request);
        if (token.isPresent()) {
            try {
                AuthenticatedUser principal = accessTokenAuthenticator.authenticate(token.get());
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, token.get(), List.of());
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (AuthenticationException ex) {
                // reason is logged by the authenticator; the request continues anonymously
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return SKIPPED_PATH_PREFIXES.stream().anyMatch(path::startsWith);
    }
}
