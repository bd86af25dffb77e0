package com.chatapi.backend.modules.auth.application.revocation;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.chatapi.backend.modules.auth.application.AccessTokenCodec;
import com.chatapi.backend.modules.auth.application.AccessTokenCodec.AccessTokenClaims;
import com.chatapi.backend.modules.auth.application.TokenHasher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 단일 인스턴스용 블랙리스트. 토큰의 SHA-256 해시를 키로 만료 시각을 보관한다.
 */
@Component
@ConditionalOnProperty(name = "app.auth.revocation.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRevocationRegistry implements RevocationRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRevocationRegistry.class);

    private final Map<String, Instant> entries = new ConcurrentHashMap<>();
    private final AccessTokenCodec accessTokenCodec;
    private final Clock clock;

    public InMemoryRevocationRegistry(AccessTokenCodec accessTokenCodec, Clock clock) {
        this.accessTokenCodec = accessTokenCodec;
        this.clock = clock;
    }

    @Override
    public void blacklist(String token) {
        Optional<AccessTokenClaims> claims = accessTokenCodec.decodeIgnoringExpiry(token);
        if (claims.isEmpty()) {
            log.debug("Skipping blacklist for undecodable token");
            return;
        }
        Instant expiresAt = claims.get().expiresAt().toInstant();
        if (!expiresAt.isAfter(clock.instant())) {
            return;
        }
        entries.merge(TokenHasher.sha256Hex(token), expiresAt, (current, next) -> current.isAfter(next) ? current : next);
    }

    @Override
    public boolean isBlacklisted(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        return entries.containsKey(TokenHasher.sha256Hex(token));
    }

    @Override
    public int sweepExpired(Instant now) {
        int removed = 0;
        for (Map.Entry<String, Instant> entry : entries.entrySet()) {
            Instant expiresAt = entry.getValue();
            // remove(key, value) leaves an entry alone if it was re-inserted concurrently
            if (!expiresAt.isAfter(now) && entries.remove(entry.getKey(), expiresAt)) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }
}
