package com.chatapi.backend.global.security;

import java.util.Optional;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 요청에서 액세스 토큰 원문을 찾아낸다. 여러 추출기를 {@link #orElse} 로 이어 우선순위를 정한다.
 */
@FunctionalInterface
public interface AccessTokenExtractor {

    Optional<String> extract(HttpServletRequest request);

    default AccessTokenExtractor orElse(AccessTokenExtractor next) {
        return request -> {
            Optional<String> token = extract(request);
            return token.isPresent() ? token : next.extract(request);
        };
    }
}
