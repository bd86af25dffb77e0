package com.chatapi.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.chatapi.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * 채팅 서비스 사용자 계정 엔터티.
 * 이메일은 trim + 소문자로 정규화된 값만 저장한다.
 */
@Entity
@Table(name = "chat_user")
public class ChatUser extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "nickname", nullable = false, length = 50)
    private String nickname;

    @Column(name = "image_url", length = 2048)
    private String imageUrl;

    @Column(name = "credentials_changed_at")
    private OffsetDateTime credentialsChangedAt;

    protected ChatUser() {
    }

    public ChatUser(String email, String passwordHash, String nickname, String imageUrl) {
        this.email = email;
        this.passwordHash = passwordHash;
        this.nickname = nickname;
        this.imageUrl = imageUrl;
    }

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    /**
     * 비밀번호를 바꾸고 변경 시각을 남긴다. 이 시각 이전에 발급된 액세스 토큰은 더 이상 인정되지 않는다.
     */
    public void changePasswordHash(String passwordHash, OffsetDateTime changedAt) {
        this.passwordHash = passwordHash;
        this.credentialsChangedAt = changedAt;
    }

    public OffsetDateTime getCredentialsChangedAt() {
        return credentialsChangedAt;
    }

    public String getNickname() {
        return nickname;
    }

    public String getImageUrl() {
        return imageUrl;
    }
}
