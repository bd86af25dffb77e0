package com.chatapi.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import com.chatapi.backend.global.error.ProblemException;
import com.chatapi.backend.modules.auth.application.AccessTokenCodec.AccessTokenClaims;
import com.chatapi.backend.modules.auth.application.AccessTokenCodec.IssuedAccessToken;
import com.chatapi.backend.modules.auth.application.RefreshSessionService.IssuedRefreshSession;
import com.chatapi.backend.modules.auth.application.revocation.RevocationRegistry;
import com.chatapi.backend.modules.auth.domain.ChatUser;
import com.chatapi.backend.modules.auth.domain.RefreshSession;
import com.chatapi.backend.modules.auth.domain.RevocationReason;
import com.chatapi.backend.modules.auth.infrastructure.persistence.ChatUserRepository;
import com.chatapi.backend.modules.auth.presentation.dto.LoginRequest;
import com.chatapi.backend.modules.auth.presentation.dto.SignupRequest;
import com.chatapi.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.server.ResponseStatusException;

/**
 * 가입, 로그인, 토큰 갱신(회전), 로그아웃, 탈퇴, 비밀번호 변경.
 * <p>
 * 401 응답은 실패 원인과 무관하게 같은 코드로 내려가고, 원인은 DEBUG/WARN 로그로만 남긴다.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String EMAIL_ALREADY_REGISTERED = "EMAIL_ALREADY_REGISTERED";
    static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    static final String INVALID_REFRESH_TOKEN = "INVALID_REFRESH_TOKEN";
    static final String REFRESH_TOKEN_REUSED = "REFRESH_TOKEN_REUSED";
    static final String INVALID_PASSWORD = "INVALID_PASSWORD";
    static final String USER_NOT_FOUND = "USER_NOT_FOUND";

    private final ChatUserRepository chatUserRepository;
    private final RefreshSessionService refreshSessionService;
    private final CredentialVerifier credentialVerifier;
    private final AccessTokenCodec accessTokenCodec;
    private final RevocationRegistry revocationRegistry;
    private final Clock clock;

    public AuthService(
            ChatUserRepository chatUserRepository,
            RefreshSessionService refreshSessionService,
            CredentialVerifier credentialVerifier,
            AccessTokenCodec accessTokenCodec,
            RevocationRegistry revocationRegistry,
            Clock clock
    ) {
        this.chatUserRepository = chatUserRepository;
        this.refreshSessionService = refreshSessionService;
        this.credentialVerifier = credentialVerifier;
        this.accessTokenCodec = accessTokenCodec;
        this.revocationRegistry = revocationRegistry;
        this.clock = clock;
    }

    // A failed unique insert poisons the persistence context, so this method must roll back on conflict.
    @Transactional
    public UserProfileResponse signUp(SignupRequest request) {
        String email = normalizeEmail(request.email());
        if (chatUserRepository.existsByEmailIgnoreCase(email)) {
            throw new ProblemException(HttpStatus.CONFLICT, EMAIL_ALREADY_REGISTERED);
        }

        ChatUser user = new ChatUser(
                email,
                credentialVerifier.hash(request.password()),
                request.nickname().trim(),
                normalizeImageUrl(request.imageUrl())
        );
        try {
            chatUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            log.info("Concurrent signup lost the race for the same email");
            throw new ProblemException(HttpStatus.CONFLICT, EMAIL_ALREADY_REGISTERED);
        }
        log.info("Registered user {}", user.getId());
        return toProfile(user);
    }

    public AuthenticatedSession login(LoginRequest request, ClientMetadata client) {
        ChatUser user = chatUserRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS));

        if (!credentialVerifier.matches(request.password(), user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS);
        }

        refreshSessionService.revokeExpiredForUser(user.getId());
        return openSession(user, client);
    }

    public AuthenticatedSession refresh(String refreshToken, ClientMetadata client) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        RefreshSession session = refreshSessionService.findByToken(refreshToken)
                .orElseThrow(() -> rejectRefresh("unknown refresh token"));

        if (session.isRevoked()) {
            log.warn("Revoked refresh session {} was presented again (reason {})",
                    session.getId(), session.getRevokedReason());
            throw rejectRefresh("revoked session");
        }

        ChatUser user = session.getUser();
        if (user == null) {
            throw rejectRefresh("session owner no longer exists");
        }

        if (session.isExpired(now)) {
            refreshSessionService.revoke(session.getId(), RevocationReason.EXPIRED);
            throw rejectRefresh("expired session");
        }

        // 재사용 방지: 조건부 update 로 먼저 폐기한 요청만 새 세션을 받는다.
        if (!refreshSessionService.revoke(session.getId(), RevocationReason.ROTATED)) {
            log.warn("Refresh session {} was rotated concurrently", session.getId());
            throw new ProblemException(HttpStatus.UNAUTHORIZED, REFRESH_TOKEN_REUSED);
        }

        return openSession(user, client);
    }

    /**
     * 액세스 토큰을 블랙리스트에 올리고, 토큰에 묶인 세션과 쿠키로 받은 세션을 폐기한다.
     * 이미 폐기된 세션이어도 실패하지 않는다.
     */
    public void logout(String accessToken, String refreshToken) {
        Optional<AccessTokenClaims> claims = accessTokenCodec.decodeIgnoringExpiry(accessToken);
        revocationRegistry.blacklist(accessToken);
        if (claims.isEmpty()) {
            log.debug("Logout with undecodable access token, nothing else to revoke");
            return;
        }

        UUID userId = claims.get().userId();
        UUID sessionId = claims.get().sessionId();
        if (sessionId != null) {
            refreshSessionService.revoke(sessionId, RevocationReason.LOGOUT);
        }
        refreshSessionService.revokeOwnedByToken(refreshToken, userId, RevocationReason.LOGOUT);
        log.info("User {} logged out", userId);
    }

    public boolean deleteAccount(UUID userId, String password, String accessToken) {
        ChatUser user = chatUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, USER_NOT_FOUND));

        if (!credentialVerifier.matches(password, user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_PASSWORD);
        }

        int revoked = refreshSessionService.revokeAllForUser(userId, RevocationReason.ACCOUNT_DELETED);
        blacklistAfterCommit(accessToken);
        chatUserRepository.delete(user);
        log.info("Deleted account {} and revoked {} refresh sessions", userId, revoked);
        return true;
    }

    public void changePassword(UUID userId, String currentPassword, String newPassword, String accessToken) {
        ChatUser user = chatUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, USER_NOT_FOUND));

        if (!credentialVerifier.matches(currentPassword, user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_PASSWORD);
        }

        user.changePasswordHash(credentialVerifier.hash(newPassword), OffsetDateTime.now(clock));
        int revoked = refreshSessionService.revokeAllForUser(userId, RevocationReason.PASSWORD_CHANGED);
        blacklistAfterCommit(accessToken);
        log.info("User {} changed password, revoked {} refresh sessions", userId, revoked);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        ChatUser user = chatUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, USER_NOT_FOUND));
        return toProfile(user);
    }

    /**
     * 블랙리스트는 트랜잭션 밖의 저장소이므로 커밋이 확정된 뒤에만 기록한다.
     */
    private void blacklistAfterCommit(String accessToken) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            revocationRegistry.blacklist(accessToken);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                revocationRegistry.blacklist(accessToken);
            }
        });
    }

    private AuthenticatedSession openSession(ChatUser user, ClientMetadata client) {
        IssuedRefreshSession refresh = refreshSessionService.create(user, client);
        IssuedAccessToken access = accessTokenCodec.issue(user.getId(), refresh.session().getId());
        return new AuthenticatedSession(
                access.token(),
                access.expiresAt(),
                refresh.token(),
                refresh.session().getExpiresAt(),
                toProfile(user)
        );
    }

    private ProblemException rejectRefresh(String reason) {
        log.debug("Refresh rejected: {}", reason);
        return new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_REFRESH_TOKEN);
    }

    static UserProfileResponse toProfile(ChatUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getNickname(),
                user.getImageUrl(),
                user.getCreatedAt()
        );
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizeImageUrl(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            return null;
        }
        return imageUrl.trim();
    }
}
