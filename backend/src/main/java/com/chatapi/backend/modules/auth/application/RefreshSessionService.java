package com.chatapi.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.chatapi.backend.modules.auth.domain.ChatUser;
import com.chatapi.backend.modules.auth.domain.RefreshSession;
import com.chatapi.backend.modules.auth.domain.RevocationReason;
import com.chatapi.backend.modules.auth.infrastructure.persistence.RefreshSessionRepository;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 리프레시 세션 저장소. 토큰 원문은 발급 시점에만 반환되고 DB 에는 해시만 남는다.
 */
@Service
@Transactional
public class RefreshSessionService {

    private final RefreshSessionRepository refreshSessionRepository;
    private final long refreshTokenTtlMillis;
    private final Clock clock;

    public RefreshSessionService(
            RefreshSessionRepository refreshSessionRepository,
            @Value("${jwt.refresh-expiration:2592000000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.refreshSessionRepository = refreshSessionRepository;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.clock = clock;
    }

    public IssuedRefreshSession create(ChatUser user, ClientMetadata client) {
        OffsetDateTime issuedAt = OffsetDateTime.now(clock);
        String token = UUID.randomUUID().toString();
        RefreshSession session = new RefreshSession(
                user,
                TokenHasher.sha256Hex(token),
                issuedAt,
                issuedAt.plus(Duration.ofMillis(refreshTokenTtlMillis)),
                client.userAgent(),
                client.ipAddress()
        );
        return new IssuedRefreshSession(refreshSessionRepository.save(session), token);
    }

    @Transactional(readOnly = true)
    public Optional<RefreshSession> findByToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return refreshSessionRepository.findByTokenHash(TokenHasher.sha256Hex(token));
    }

    /**
     * @return {@code false} when the session was already revoked, possibly by a concurrent caller
     */
    public boolean revoke(UUID sessionId, RevocationReason reason) {
        return refreshSessionRepository.revokeIfActive(sessionId, OffsetDateTime.now(clock), reason) == 1;
    }

    public int revokeOwnedByToken(String token, UUID userId, RevocationReason reason) {
        if (token == null || token.isBlank()) {
            return 0;
        }
        return refreshSessionRepository.revokeOwnedByTokenHash(
                TokenHasher.sha256Hex(token), userId, OffsetDateTime.now(clock), reason);
    }

    public int revokeAllForUser(UUID userId, RevocationReason reason) {
        return refreshSessionRepository.revokeAllByUserId(userId, OffsetDateTime.now(clock), reason);
    }

    public int revokeExpiredForUser(UUID userId) {
        return refreshSessionRepository.revokeExpiredSessions(userId, OffsetDateTime.now(clock), RevocationReason.EXPIRED);
    }

    public int revokeAllExpired() {
        return refreshSessionRepository.revokeAllExpired(OffsetDateTime.now(clock), RevocationReason.EXPIRED);
    }

    public int purgeRevokedBefore(OffsetDateTime cutoff) {
        return refreshSessionRepository.deleteRevokedExpiredBefore(cutoff);
    }

    public record IssuedRefreshSession(RefreshSession session, String token) {
    }
}
