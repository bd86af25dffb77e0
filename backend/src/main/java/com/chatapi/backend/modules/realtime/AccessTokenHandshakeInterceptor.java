package com.chatapi.backend.modules.realtime;

import java.util.Map;
import java.util.Optional;

import com.chatapi.backend.global.security.AccessTokenAuthenticator;
import com.chatapi.backend.global.security.AccessTokenExtractor;
import com.chatapi.backend.global.security.AccessTokenExtractors;
import com.chatapi.backend.global.security.AuthCookies;
import com.chatapi.backend.global.security.AuthenticatedUser;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.security.core.AuthenticationException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

/**
 * WebSocket 업그레이드 전에 액세스 토큰을 검증한다. 실패하면 프레임 교환 없이 401 로 끝낸다.
 * 토큰 위치 우선순위: Authorization 헤더, {@code token} 쿼리 파라미터, {@code jwt} 쿠키.
 */
@Component
public class AccessTokenHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AccessTokenHandshakeInterceptor.class);

    public static final String AUTHENTICATED_USER_ATTRIBUTE = "authenticatedUser";
    static final String TOKEN_QUERY_PARAMETER = "token";

    private final AccessTokenAuthenticator accessTokenAuthenticator;
    private final AccessTokenExtractor tokenExtractor;

    public AccessTokenHandshakeInterceptor(AccessTokenAuthenticator accessTokenAuthenticator) {
        this.accessTokenAuthenticator = accessTokenAuthenticator;
        this.tokenExtractor = AccessTokenExtractors.bearerHeader()
                .orElse(AccessTokenExtractors.queryParameter(TOKEN_QUERY_PARAMETER))
                .orElse(AccessTokenExtractors.cookie(AuthCookies.ACCESS_TOKEN_COOKIE));
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        if (!(request instanceof ServletServerHttpRequest servletRequest)) {
            log.debug("Rejecting non-servlet handshake from {}", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        HttpServletRequest httpRequest = servletRequest.getServletRequest();
        Optional<String> token = tokenExtractor.extract(httpRequest);
        try {
            AuthenticatedUser user = accessTokenAuthenticator.authenticate(token.orElse(null));
            attributes.put(AUTHENTICATED_USER_ATTRIBUTE, user);
            return true;
        } catch (AuthenticationException ex) {
            log.debug("Rejecting WebSocket handshake from {}", httpRequest.getRemoteAddr());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("WebSocket handshake failed", exception);
        }
    }
}
