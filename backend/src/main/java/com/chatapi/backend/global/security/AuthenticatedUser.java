package com.chatapi.backend.global.security;

import java.util.UUID;

/**
 * 인증된 요청/연결에 붙는 주체 정보. {@code sessionId} 는 토큰의 {@code sid} 클레임이며 없을 수 있다.
 */
public record AuthenticatedUser(UUID userId, String email, String nickname, UUID sessionId) {
}
