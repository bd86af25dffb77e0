package com.chatapi.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.chatapi.backend.modules.auth.domain.ChatUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChatUserRepository extends JpaRepository<ChatUser, UUID> {

    @Query("select u from ChatUser u where lower(u.email) = lower(:email)")
    Optional<ChatUser> findByEmailIgnoreCase(@Param("email") String email);

    @Query("select count(u) > 0 from ChatUser u where lower(u.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);
}
