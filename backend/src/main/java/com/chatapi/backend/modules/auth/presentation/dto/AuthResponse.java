package com.chatapi.backend.modules.auth.presentation.dto;

/**
 * 로그인/갱신 응답 본문. 리프레시 토큰은 쿠키로만 전달한다.
 */
public record AuthResponse(String token, UserProfileResponse user) {
}
