package com.chatapi.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.chatapi.backend.modules.auth.domain.RefreshSession;
import com.chatapi.backend.modules.auth.domain.RevocationReason;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Bulk updates bypass auditing, so every revoke query stamps {@code updatedAt} itself.
 */
public interface RefreshSessionRepository extends JpaRepository<RefreshSession, UUID> {

    @Query("""
            select rs
              from RefreshSession rs
              left join fetch rs.user
             where rs.tokenHash = :tokenHash
            """)
    Optional<RefreshSession> findByTokenHash(@Param("tokenHash") String tokenHash);

    /**
     * Compare-and-set revoke. Returns 0 when another transaction already revoked the row.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
            update RefreshSession rs
               set rs.revoked = true,
                   rs.revokedAt = :revokedAt,
                   rs.revokedReason = :reason,
                   rs.updatedAt = :revokedAt
             where rs.id = :id
               and rs.revoked = false
            """)
    int revokeIfActive(@Param("id") UUID id,
                       @Param("revokedAt") OffsetDateTime revokedAt,
                       @Param("reason") RevocationReason reason);

    @Modifying(flushAutomatically = true)
    @Query("""
            update RefreshSession rs
               set rs.revoked = true,
                   rs.revokedAt = :revokedAt,
                   rs.revokedReason = :reason,
                   rs.updatedAt = :revokedAt
             where rs.tokenHash = :tokenHash
               and rs.user.id = :userId
               and rs.revoked = false
            """)
    int revokeOwnedByTokenHash(@Param("tokenHash") String tokenHash,
                               @Param("userId") UUID userId,
                               @Param("revokedAt") OffsetDateTime revokedAt,
                               @Param("reason") RevocationReason reason);

    @Modifying(flushAutomatically = true)
    @Query("""
            update RefreshSession rs
               set rs.revoked = true,
                   rs.revokedAt = :revokedAt,
                   rs.revokedReason = :reason,
                   rs.updatedAt = :revokedAt
             where rs.user.id = :userId
               and rs.revoked = false
            """)
    int revokeAllByUserId(@Param("userId") UUID userId,
                          @Param("revokedAt") OffsetDateTime revokedAt,
                          @Param("reason") RevocationReason reason);

    @Modifying(flushAutomatically = true)
    @Query("""
            update RefreshSession rs
               set rs.revoked = true,
                   rs.revokedAt = :now,
                   rs.revokedReason = :reason,
                   rs.updatedAt = :now
             where rs.user.id = :userId
               and rs.revoked = false
               and rs.expiresAt <= :now
            """)
    int revokeExpiredSessions(@Param("userId") UUID userId,
                              @Param("now") OffsetDateTime now,
                              @Param("reason") RevocationReason reason);

    @Modifying(flushAutomatically = true)
    @Query("""
            update RefreshSession rs
               set rs.revoked = true,
                   rs.revokedAt = :now,
                   rs.revokedReason = :reason,
                   rs.updatedAt = :now
             where rs.revoked = false
               and rs.expiresAt <= :now
            """)
    int revokeAllExpired(@Param("now") OffsetDateTime now,
                         @Param("reason") RevocationReason reason);

    @Modifying(flushAutomatically = true)
    @Query("delete from RefreshSession rs where rs.revoked = true and rs.expiresAt < :cutoff")
    int deleteRevokedExpiredBefore(@Param("cutoff") OffsetDateTime cutoff);
}
