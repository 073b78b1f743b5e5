package com.qualitrack.backend.modules.credential.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

import com.qualitrack.backend.global.error.AuthenticationException;
import com.qualitrack.backend.global.error.ConflictException;
import com.qualitrack.backend.global.error.PolicyViolationException;
import com.qualitrack.backend.global.error.ResourceNotFoundException;
import com.qualitrack.backend.modules.credential.domain.AppUser;
import com.qualitrack.backend.modules.credential.domain.AppUserStatus;
import com.qualitrack.backend.modules.credential.domain.CredentialFormat;
import com.qualitrack.backend.modules.credential.domain.LegacyPasswordDigest;
import com.qualitrack.backend.modules.credential.infrastructure.persistence.AppUserRepository;

import org.springframework.lang.NonNull;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Password store accepting both the adaptive hash and the legacy digest.
 * The adaptive hash is checked first and is authoritative; the legacy digest is a fallback that
 * gets upgraded on the first successful use.
 */
@Service
@Transactional
public class CredentialStore {

    private static final int LOGIN_MAX_LENGTH = 50;

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final CredentialMigrator credentialMigrator;
    private final Clock clock;
    private final String timingDecoyHash;

    public CredentialStore(
            AppUserRepository appUserRepository,
            PasswordEncoder passwordEncoder,
            CredentialMigrator credentialMigrator,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.credentialMigrator = credentialMigrator;
        this.clock = clock;
        this.timingDecoyHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    /**
     * Checks a login attempt. Runs without a surrounding transaction: the account lookup
     * releases its connection before a legacy upgrade asks for one, so concurrent legacy
     * logins never hold two pooled connections each. Callers should not invoke it from
     * inside a transaction of their own.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public CredentialVerification verify(String login, String password) {
        String normalizedLogin = normalizeLogin(login);
        AppUser user = normalizedLogin == null
                ? null
                : appUserRepository.findByLoginIgnoreCase(normalizedLogin).orElse(null);
        if (user == null || password == null) {
            // same BCrypt cost as a real account, so unknown logins are not faster
            passwordEncoder.matches(password != null ? password : "", timingDecoyHash);
            return CredentialVerification.unknown();
        }

        CredentialFormat matched = match(user, password);
        if (!user.isActive()) {
            return CredentialVerification.rejected(CredentialFormat.NONE, user.getId(), user.getLogin());
        }
        if (matched == CredentialFormat.NONE) {
            return CredentialVerification.rejected(user.authoritativeFormat(), user.getId(), user.getLogin());
        }
        if (matched == CredentialFormat.LEGACY) {
            credentialMigrator.migrate(user.getId(), password);
        }
        return CredentialVerification.accepted(matched, user.getId(), user.getLogin());
    }

    /**
     * Re-verifies the old password by the same rule as {@link #verify} and stores the new one
     * as an adaptive hash only. Any legacy digest is removed.
     *
     * @return id of the account whose password changed
     */
    public Long changePassword(String login, String oldPassword, String newPassword) {
        String normalizedLogin = normalizeLogin(login);
        AppUser user = normalizedLogin == null
                ? null
                : appUserRepository.findByLoginIgnoreCase(normalizedLogin).orElse(null);
        if (user == null || oldPassword == null || !user.isActive()
                || match(user, oldPassword) == CredentialFormat.NONE) {
            throw new AuthenticationException();
        }
        requireUsablePassword(newPassword);
        appUserRepository.replaceCredential(user.getId(), passwordEncoder.encode(newPassword));
        return user.getId();
    }

    /**
     * New accounts are always written in the adaptive format.
     */
    public AppUser createUser(String login, String fullName, String password) {
        String normalizedLogin = normalizeLogin(login);
        if (normalizedLogin == null) {
            throw new PolicyViolationException("credential.login_invalid",
                    "Login must be 1-" + LOGIN_MAX_LENGTH + " characters");
        }
        requireUsablePassword(password);
        if (appUserRepository.existsByLoginIgnoreCase(normalizedLogin)) {
            throw new ConflictException("credential.login_taken", "Login already exists: " + normalizedLogin);
        }

        AppUser user = new AppUser();
        user.setLogin(normalizedLogin);
        user.setFullName(fullName != null && !fullName.isBlank() ? fullName.trim() : normalizedLogin);
        user.setStatus(AppUserStatus.ACTIVE);
        user.useAdaptiveHash(passwordEncoder.encode(password));
        return appUserRepository.save(user);
    }

    /**
     * Soft delete. The row stays because grants and audit history reference it.
     */
    public AppUser deactivateUser(@NonNull Long userId) {
        AppUser user = findUser(userId);
        if (user.getStatus() == AppUserStatus.INACTIVE) {
            return user;
        }
        user.setStatus(AppUserStatus.INACTIVE);
        user.setDeactivatedAt(OffsetDateTime.now(clock));
        return appUserRepository.save(user);
    }

    @Transactional(readOnly = true)
    public AppUser findUser(@NonNull Long userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("credential.user_not_found", "No user with id " + userId));
    }

    /**
     * Accounts per stored credential format, to follow the legacy migration window.
     */
    @Transactional(readOnly = true)
    public Map<CredentialFormat, Long> countByFormat() {
        Map<CredentialFormat, Long> counts = new EnumMap<>(CredentialFormat.class);
        counts.put(CredentialFormat.ADAPTIVE, appUserRepository.countByPasswordFormat(CredentialFormat.ADAPTIVE));
        counts.put(CredentialFormat.LEGACY, appUserRepository.countByPasswordFormat(CredentialFormat.LEGACY));
        return counts;
    }

    private CredentialFormat match(AppUser user, String password) {
        String adaptiveHash = user.getAdaptiveHash();
        if (adaptiveHash != null) {
            return passwordEncoder.matches(password, adaptiveHash) ? CredentialFormat.ADAPTIVE : CredentialFormat.NONE;
        }
        String legacyDigest = user.getLegacyDigest();
        if (legacyDigest != null && LegacyPasswordDigest.matches(password, legacyDigest)) {
            return CredentialFormat.LEGACY;
        }
        return CredentialFormat.NONE;
    }

    private void requireUsablePassword(String password) {
        if (password == null || password.isBlank()) {
            throw new PolicyViolationException("credential.password_blank", "Password must not be blank");
        }
    }

    private String normalizeLogin(String rawLogin) {
        if (rawLogin == null) {
            return null;
        }
        String trimmed = rawLogin.trim();
        if (trimmed.isEmpty() || trimmed.length() > LOGIN_MAX_LENGTH) {
            return null;
        }
        return trimmed;
    }
}
