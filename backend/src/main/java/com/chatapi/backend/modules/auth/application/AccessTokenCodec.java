package com.chatapi.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

import com.chatapi.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * HS256 액세스 토큰 발급/검증.
 * <p>
 * 토큰에는 {@code sub}(사용자), {@code iat}, {@code exp} 외에 {@code jti}(토큰 고유값)와
 * {@code sid}(함께 발급된 리프레시 세션) 클레임이 들어간다.
 */
@Service
public class AccessTokenCodec {

    private static final Logger log = LoggerFactory.getLogger(AccessTokenCodec.class);

    static final String SESSION_ID_CLAIM = "sid";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;
    private final JwtParser parser;

    public AccessTokenCodec(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:3600000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(tokenProvider.getSecretKey())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public IssuedAccessToken issue(UUID userId, UUID sessionId) {
        Instant now = clock.instant();
        Instant expiresAt = now.plusMillis(accessTokenTtlMillis);

        String token = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .claim(SESSION_ID_CLAIM, sessionId.toString())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedAccessToken(
                token,
                OffsetDateTime.ofInstant(now, clock.getZone()),
                OffsetDateTime.ofInstant(expiresAt, clock.getZone())
        );
    }

    /**
     * 서명과 만료를 모두 검증한다.
     *
     * @throws InvalidTokenException 서명 불일치, 만료, 형식 오류, 필수 클레임 누락
     */
    public AccessTokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Access token is empty", null);
        }
        AccessTokenClaims claims;
        try {
            claims = toAccessTokenClaims(parser.parseSignedClaims(token).getPayload());
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
        // jjwt accepts now == exp; a token is only valid while now < exp
        if (!clock.instant().isBefore(claims.expiresAt().toInstant())) {
            throw new InvalidTokenException("Access token expired", null);
        }
        return claims;
    }

    /**
     * 서명은 검증하되 만료 여부는 무시하고 클레임을 읽는다. 읽을 수 없으면 빈 값.
     */
    public Optional<AccessTokenClaims> decodeIgnoringExpiry(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException expired) {
            claims = expired.getClaims();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Ignoring undecodable access token: {}", e.getMessage());
            return Optional.empty();
        }
        try {
            return Optional.of(toAccessTokenClaims(claims));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Ignoring access token with malformed claims: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private AccessTokenClaims toAccessTokenClaims(Claims claims) {
        if (claims.getSubject() == null || claims.getExpiration() == null) {
            throw new IllegalArgumentException("Access token lacks sub or exp");
        }
        UUID userId = UUID.fromString(claims.getSubject());
        String sessionClaim = claims.get(SESSION_ID_CLAIM, String.class);
        UUID sessionId = sessionClaim != null ? UUID.fromString(sessionClaim) : null;
        Instant expiresAt = claims.getExpiration().toInstant();
        Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : expiresAt;
        return new AccessTokenClaims(
                claims.getId(),
                userId,
                sessionId,
                OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                OffsetDateTime.ofInstant(expiresAt, clock.getZone())
        );
    }

    public record IssuedAccessToken(String token, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public record AccessTokenClaims(
            String tokenId,
            UUID userId,
            UUID sessionId,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
