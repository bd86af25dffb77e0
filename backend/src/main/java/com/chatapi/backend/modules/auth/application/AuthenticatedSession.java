package com.chatapi.backend.modules.auth.application;

import java.time.OffsetDateTime;

import com.chatapi.backend.modules.auth.presentation.dto.UserProfileResponse;

/**
 * 로그인/토큰 갱신 결과. 리프레시 토큰 원문은 이 객체로만 클라이언트에 전달된다.
 */
public record AuthenticatedSession(
        String accessToken,
        OffsetDateTime accessTokenExpiresAt,
        String refreshToken,
        OffsetDateTime refreshTokenExpiresAt,
        UserProfileResponse user
) {
}
