package com.chatapi.backend.global.security;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;

import com.chatapi.backend.modules.auth.application.AccessTokenCodec;
import com.chatapi.backend.modules.auth.application.AccessTokenCodec.AccessTokenClaims;
import com.chatapi.backend.modules.auth.application.AccessTokenCodec.InvalidTokenException;
import com.chatapi.backend.modules.auth.application.revocation.RevocationRegistry;
import com.chatapi.backend.modules.auth.domain.ChatUser;
import com.chatapi.backend.modules.auth.infrastructure.persistence.ChatUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.stereotype.Component;

/**
 * HTTP 요청과 WebSocket 핸드셰이크가 함께 쓰는 액세스 토큰 인증 절차.
 * 서명/만료 검증, 블랙리스트 확인, 사용자 조회(비밀번호 변경 이전 토큰 거부 포함) 순서로 진행하며 어떤 단계에서 실패해도 같은 예외를 던진다.
 */
@Component
public class AccessTokenAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(AccessTokenAuthenticator.class);

    static final String UNAUTHORIZED = "UNAUTHORIZED";

    private final AccessTokenCodec accessTokenCodec;
    private final RevocationRegistry revocationRegistry;
    private final ChatUserRepository chatUserRepository;

    public AccessTokenAuthenticator(
            AccessTokenCodec accessTokenCodec,
            RevocationRegistry revocationRegistry,
            ChatUserRepository chatUserRepository
    ) {
        this.accessTokenCodec = accessTokenCodec;
        this.revocationRegistry = revocationRegistry;
        this.chatUserRepository = chatUserRepository;
    }

    public AuthenticatedUser authenticate(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            throw reject("no access token");
        }

        AccessTokenClaims claims;
        try {
            claims = accessTokenCodec.verify(rawToken);
        } catch (InvalidTokenException ex) {
            throw reject(ex.getCause() != null ? ex.getCause().getMessage() : ex.getMessage());
        }

        if (revocationRegistry.isBlacklisted(rawToken)) {
            throw reject("token " + claims.tokenId() + " is blacklisted");
        }

        ChatUser user = chatUserRepository.findById(claims.userId())
                .orElseThrow(() -> reject("user " + claims.userId() + " no longer exists"));

        if (issuedBeforeCredentialsChange(claims, user)) {
            throw reject("token " + claims.tokenId() + " predates the password change of user " + user.getId());
        }

        return new AuthenticatedUser(user.getId(), user.getEmail(), user.getNickname(), claims.sessionId());
    }

    // iat has second precision, so the change instant is truncated the same way
    private static boolean issuedBeforeCredentialsChange(AccessTokenClaims claims, ChatUser user) {
        OffsetDateTime changedAt = user.getCredentialsChangedAt();
        return changedAt != null && claims.issuedAt().isBefore(changedAt.truncatedTo(ChronoUnit.SECONDS));
    }

    private static BadCredentialsException reject(String reason) {
        log.debug("Access token rejected: {}", reason);
        return new BadCredentialsException(UNAUTHORIZED);
    }
}
