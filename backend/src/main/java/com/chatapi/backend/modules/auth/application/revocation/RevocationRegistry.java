package com.chatapi.backend.modules.auth.application.revocation;

import java.time.Instant;

/**
 * 로그아웃/탈퇴 등으로 만료 전에 무효화된 액세스 토큰 목록.
 * 각 항목은 해당 토큰의 만료 시각까지만 유지된다.
 */
public interface RevocationRegistry {

    /**
     * Records the token until its own expiry. Tokens that cannot be decoded or are already
     * expired are ignored.
     */
    void blacklist(String token);

    boolean isBlacklisted(String token);

    /**
     * @return number of entries removed
     */
    int sweepExpired(Instant now);
}
