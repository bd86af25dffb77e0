package com.chatapi.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.chatapi.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * 로그인 한 번으로 발급된 리프레시 세션.
 * 원본 토큰 값은 저장하지 않고 SHA-256 해시만 보관한다.
 * 유효 조건: {@code revoked == false} 이면서 {@code now < expiresAt}.
 */
@Entity
@Table(name = "refresh_session")
public class RefreshSession extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    // nullable: rows outlive their user after account deletion
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    private ChatUser user;

    @Column(name = "token_hash", nullable = false, unique = true, length = 64)
    private String tokenHash;

    @Column(name = "issued_at", nullable = false)
    private OffsetDateTime issuedAt;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    @Column(name = "is_revoked", nullable = false)
    private boolean revoked;

    @Enumerated(EnumType.STRING)
    @Column(name = "revoked_reason", length = 32)
    private RevocationReason revokedReason;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    protected RefreshSession() {
    }

    public RefreshSession(ChatUser user, String tokenHash, OffsetDateTime issuedAt, OffsetDateTime expiresAt,
                          String userAgent, String ipAddress) {
        this.user = user;
        this.tokenHash = tokenHash;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
        this.userAgent = userAgent;
        this.ipAddress = ipAddress;
    }

    public UUID getId() {
        return id;
    }

    public ChatUser getUser() {
        return user;
    }

    public String getTokenHash() {
        return tokenHash;
    }

    public OffsetDateTime getIssuedAt() {
        return issuedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public boolean isRevoked() {
        return revoked;
    }

    public RevocationReason getRevokedReason() {
        return revokedReason;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public void revoke(OffsetDateTime at, RevocationReason reason) {
        if (revoked) {
            return;
        }
        this.revoked = true;
        this.revokedAt = at;
        this.revokedReason = reason;
    }

    public boolean isExpired(OffsetDateTime now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isActive(OffsetDateTime now) {
        return !revoked && !isExpired(now);
    }
}
