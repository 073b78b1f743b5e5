package com.qualitrack.backend.modules.credential.infrastructure.persistence;

import java.util.Optional;

import com.qualitrack.backend.modules.credential.domain.AppUser;
import com.qualitrack.backend.modules.credential.domain.CredentialFormat;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    @Query("select u from AppUser u where lower(u.login) = lower(:login)")
    Optional<AppUser> findByLoginIgnoreCase(@Param("login") String login);

    /**
     * Serializes writers that act on one account, such as session opening.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from AppUser u where u.id = :id")
    Optional<AppUser> findByIdForUpdate(@Param("id") Long id);

    @Query("""
            select case when count(u) > 0 then true else false end
              from AppUser u
             where lower(u.login) = lower(:login)
            """)
    boolean existsByLoginIgnoreCase(@Param("login") String login);

    /**
     * Upgrades a legacy credential in one statement. Returns 0 when another writer already did it.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update AppUser u
               set u.adaptiveHash = :adaptiveHash,
                   u.legacyDigest = null,
                   u.passwordFormat = com.qualitrack.backend.modules.credential.domain.CredentialFormat.ADAPTIVE
             where u.id = :userId
               and u.legacyDigest is not null
            """)
    int upgradeLegacyCredential(@Param("userId") Long userId, @Param("adaptiveHash") String adaptiveHash);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update AppUser u
               set u.adaptiveHash = :adaptiveHash,
                   u.legacyDigest = null,
                   u.passwordFormat = com.qualitrack.backend.modules.credential.domain.CredentialFormat.ADAPTIVE
             where u.id = :userId
            """)
    int replaceCredential(@Param("userId") Long userId, @Param("adaptiveHash") String adaptiveHash);

    long countByPasswordFormat(CredentialFormat passwordFormat);
}
