package com.chatapi.backend.modules.auth.application.revocation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.chatapi.backend.modules.auth.application.AccessTokenCodec;
import com.chatapi.backend.modules.auth.application.AccessTokenCodec.AccessTokenClaims;
import com.chatapi.backend.modules.auth.application.TokenHasher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * 여러 인스턴스가 공유하는 Redis 블랙리스트. 키마다 남은 수명만큼 TTL 을 건다.
 */
@Component
@ConditionalOnProperty(name = "app.auth.revocation.store", havingValue = "redis")
public class RedisRevocationRegistry implements RevocationRegistry {

    private static final Logger log = LoggerFactory.getLogger(RedisRevocationRegistry.class);

    static final String KEY_PREFIX = "auth:revoked:";

    private final StringRedisTemplate redisTemplate;
    private final AccessTokenCodec accessTokenCodec;
    private final Clock clock;

    public RedisRevocationRegistry(StringRedisTemplate redisTemplate, AccessTokenCodec accessTokenCodec, Clock clock) {
        this.redisTemplate = redisTemplate;
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
        Duration remaining = Duration.between(clock.instant(), claims.get().expiresAt().toInstant());
        if (remaining.isZero() || remaining.isNegative()) {
            return;
        }
        redisTemplate.opsForValue().set(key(token), claims.get().userId().toString(), remaining);
    }

    @Override
    public boolean isBlacklisted(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(key(token)));
        } catch (DataAccessException ex) {
            // fail closed: an unreachable blacklist rejects the token
            log.error("Revocation lookup failed, treating token as revoked", ex);
            return true;
        }
    }

    @Override
    public int sweepExpired(Instant now) {
        return 0;
    }

    private static String key(String token) {
        return KEY_PREFIX + TokenHasher.sha256Hex(token);
    }
}
