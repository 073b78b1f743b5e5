package com.qualitrack.backend.modules.session.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.qualitrack.backend.modules.session.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, Long> {

    @Query("""
            select us
              from UserSession us
              join fetch us.user u
             where us.tokenHash = :tokenHash
            """)
    Optional<UserSession> findByTokenHash(@Param("tokenHash") String tokenHash);

    /**
     * Open sessions of a user, least recently used first.
     */
    @Query("""
            select us
              from UserSession us
             where us.user.id = :userId
               and us.revokedAt is null
               and us.expiresAt > :now
             order by us.lastActivityAt asc, us.id asc
            """)
    List<UserSession> findActiveSessions(@Param("userId") Long userId, @Param("now") OffsetDateTime now);

    @Query("""
            select us
              from UserSession us
             where us.user.id = :userId
             order by us.issuedAt desc, us.id desc
            """)
    List<UserSession> findAllByUserId(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :now,
                   us.revokedReason = :reason
             where us.tokenHash = :tokenHash
               and us.user.id = :userId
               and us.revokedAt is null
            """)
    int revokeByTokenHash(@Param("userId") Long userId,
                          @Param("tokenHash") String tokenHash,
                          @Param("now") OffsetDateTime now,
                          @Param("reason") String reason);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :now,
                   us.revokedReason = :reason
             where us.user.id = :userId
               and us.revokedAt is null
               and us.expiresAt > :now
            """)
    int revokeActiveSessions(@Param("userId") Long userId,
                             @Param("now") OffsetDateTime now,
                             @Param("reason") String reason);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :now,
                   us.revokedReason = :reason
             where us.user.id = :userId
               and us.tokenHash <> :keptTokenHash
               and us.revokedAt is null
               and us.expiresAt > :now
            """)
    int revokeActiveSessionsExcept(@Param("userId") Long userId,
                                   @Param("keptTokenHash") String keptTokenHash,
                                   @Param("now") OffsetDateTime now,
                                   @Param("reason") String reason);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :now,
                   us.revokedReason = :reason
             where us.user.id = :userId
               and us.revokedAt is null
               and us.expiresAt <= :now
            """)
    int revokeExpiredSessions(@Param("userId") Long userId,
                              @Param("now") OffsetDateTime now,
                              @Param("reason") String reason);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :now,
                   us.revokedReason = :reason
             where us.revokedAt is null
               and us.expiresAt <= :now
            """)
    int revokeAllExpiredSessions(@Param("now") OffsetDateTime now, @Param("reason") String reason);
}
