package com.chatapi.backend.modules.auth.application.revocation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.UUID;

import com.chatapi.backend.modules.auth.application.AccessTokenCodec;
import com.chatapi.backend.modules.auth.application.TokenHasher;
import com.chatapi.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.chatapi.backend.support.AuthFixture;
import com.chatapi.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisRevocationRegistryTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private MutableClock clock;
    private AccessTokenCodec codec;
    private RedisRevocationRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        codec = new AccessTokenCodec(new JwtTokenProvider(AuthFixture.TEST_SECRET), 3_600_000L, clock);
        registry = new RedisRevocationRegistry(redisTemplate, codec, clock);
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    void blacklistStoresHashedKeyWithRemainingLifetime() {
        String token = codec.issue(USER_ID, UUID.randomUUID()).token();
        clock.advance(Duration.ofMinutes(15));

        registry.blacklist(token);

        verify(valueOperations).set(
                RedisRevocationRegistry.KEY_PREFIX + TokenHasher.sha256Hex(token),
                USER_ID.toString(),
                Duration.ofMinutes(45)
        );
    }

    @Test
    void expiredOrUndecodableTokensAreNotWritten() {
        String token = codec.issue(USER_ID, UUID.randomUUID()).token();
        clock.advance(Duration.ofHours(2));

        registry.blacklist(token);
        registry.blacklist("garbage");

        verify(valueOperations, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void lookupChecksKeyPresence() {
        String token = codec.issue(USER_ID, UUID.randomUUID()).token();
        when(redisTemplate.hasKey(eq(RedisRevocationRegistry.KEY_PREFIX + TokenHasher.sha256Hex(token))))
                .thenReturn(true);

        assertThat(registry.isBlacklisted(token)).isTrue();
    }

    @Test
    void unreachableRedisTreatsTokenAsRevoked() {
        when(redisTemplate.hasKey(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(registry.isBlacklisted("some-token")).isTrue();
    }

    @Test
    void sweepIsLeftToRedisExpiry() {
        assertThat(registry.sweepExpired(clock.instant())).isZero();
    }
}
