package com.qualitrack.backend.modules.session.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.qualitrack.backend.global.error.PolicyViolationException;
import com.qualitrack.backend.global.error.ResourceNotFoundException;
import com.qualitrack.backend.modules.credential.domain.AppUser;
import com.qualitrack.backend.modules.credential.infrastructure.persistence.AppUserRepository;
import com.qualitrack.backend.modules.session.domain.SessionTokens;
import com.qualitrack.backend.modules.session.domain.UserSession;
import com.qualitrack.backend.modules.session.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Opens, validates and closes login sessions.
 *
 * <p>A session lasts {@code app.access.session.timeout}, or {@code remember-me-timeout} when the
 * user asked to be remembered. A user holds at most {@code max-per-user} open sessions; opening
 * one more closes the least recently used.</p>
 */
@Service
@Transactional
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    public static final String REASON_LOGOUT = "LOGOUT";
    public static final String REASON_PASSWORD_CHANGED = "PASSWORD_CHANGED";
    public static final String REASON_USER_DEACTIVATED = "USER_DEACTIVATED";
    static final String REASON_EXPIRED = "EXPIRED";
    static final String REASON_LIMIT_EXCEEDED = "LIMIT_EXCEEDED";
    static final String REASON_USER_INACTIVE = "USER_INACTIVE";
    static final String REASON_OTHER_SESSIONS_CLOSED = "OTHER_SESSIONS_CLOSED";
    private static final int DEVICE_INFO_MAX_LENGTH = 200;

    private final UserSessionRepository userSessionRepository;
    private final AppUserRepository appUserRepository;
    private final Clock clock;
    private final Duration timeout;
    private final Duration rememberMeTimeout;
    private final int maxSessionsPerUser;

    public SessionService(
            UserSessionRepository userSessionRepository,
            AppUserRepository appUserRepository,
            Clock clock,
            @Value("${app.access.session.timeout:PT1H}") Duration timeout,
            @Value("${app.access.session.remember-me-timeout:P30D}") Duration rememberMeTimeout,
            @Value("${app.access.session.max-per-user:5}") int maxSessionsPerUser
    ) {
        this.userSessionRepository = userSessionRepository;
        this.appUserRepository = appUserRepository;
        this.clock = clock;
        this.timeout = timeout;
        this.rememberMeTimeout = rememberMeTimeout;
        this.maxSessionsPerUser = maxSessionsPerUser;
    }

    /**
     * Opens a session for an already authenticated user. The account row is locked so that
     * concurrent logins of one user cannot overshoot the session limit.
     */
    public IssuedSession openSession(@NonNull Long userId, boolean rememberMe, String deviceInfo) {
        AppUser user = appUserRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ResourceNotFoundException("session.user_not_found", "No user with id " + userId));
        if (!user.isActive()) {
            throw new PolicyViolationException("session.user_inactive", "Sessions cannot be opened for inactive accounts");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        userSessionRepository.revokeExpiredSessions(userId, now, REASON_EXPIRED);
        enforceSessionLimit(userId, now);

        String token = SessionTokens.newToken();
        OffsetDateTime expiresAt = now.plus(rememberMe ? rememberMeTimeout : timeout);
        UserSession session = userSessionRepository.save(new UserSession(
                appUserRepository.getReferenceById(userId),
                SessionTokens.digest(token),
                rememberMe,
                normalizeDeviceInfo(deviceInfo),
                now,
                expiresAt
        ));
        log.debug("Opened session {} for user {} (remember me: {})", session.getId(), userId, rememberMe);
        return new IssuedSession(session.getId(), userId, token, rememberMe, expiresAt);
    }

    /**
     * Resolves a bearer token to its open session and records the activity. Unknown, closed and
     * expired tokens yield empty; an expired session, or one whose account was deactivated, is
     * closed on the way.
     */
    public Optional<SessionView> validateSession(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        UserSession session = userSessionRepository.findByTokenHash(SessionTokens.digest(token)).orElse(null);
        if (session == null || session.getRevokedAt() != null) {
            return Optional.empty();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!session.getExpiresAt().isAfter(now)) {
            session.revoke(now, REASON_EXPIRED);
            log.debug("Session {} of user {} expired", session.getId(), session.getUser().getId());
            return Optional.empty();
        }
        if (!session.getUser().isActive()) {
            session.revoke(now, REASON_USER_INACTIVE);
            return Optional.empty();
        }
        session.touch(now);
        return Optional.of(SessionView.from(session, now));
    }

    /**
     * Closes one session of the user. A token of another user is left alone.
     */
    public boolean invalidateSession(@NonNull Long userId, String token, String reason) {
        if (token == null || token.isBlank()) {
            return false;
        }
        return userSessionRepository.revokeByTokenHash(userId, SessionTokens.digest(token),
                OffsetDateTime.now(clock), reason) > 0;
    }

    public int invalidateAllUserSessions(@NonNull Long userId, String reason) {
        int closed = userSessionRepository.revokeActiveSessions(userId, OffsetDateTime.now(clock), reason);
        if (closed > 0) {
            log.info("Closed {} session(s) of user {} ({})", closed, userId, reason);
        }
        return closed;
    }

    /**
     * Closes every open session of the user except the one holding {@code currentToken}.
     */
    public int invalidateOtherSessions(@NonNull Long userId, String currentToken) {
        if (currentToken == null || currentToken.isBlank()) {
            throw new IllegalArgumentException("current session token is required");
        }
        return userSessionRepository.revokeActiveSessionsExcept(userId, SessionTokens.digest(currentToken),
                OffsetDateTime.now(clock), REASON_OTHER_SESSIONS_CLOSED);
    }

    @Transactional(readOnly = true)
    public List<SessionView> listUserSessions(@NonNull Long userId, boolean activeOnly) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<UserSession> sessions = activeOnly
                ? userSessionRepository.findActiveSessions(userId, now)
                : userSessionRepository.findAllByUserId(userId);
        return sessions.stream()
                .map(session -> SessionView.from(session, now))
                .toList();
    }

    /**
     * Marks every lapsed session as closed. Lookups already treat them as expired; this keeps
     * the open-session set small.
     */
    public int cleanupExpiredSessions() {
        return userSessionRepository.revokeAllExpiredSessions(OffsetDateTime.now(clock), REASON_EXPIRED);
    }

    private void enforceSessionLimit(Long userId, OffsetDateTime now) {
        List<UserSession> active = userSessionRepository.findActiveSessions(userId, now);
        int excess = active.size() - maxSessionsPerUser + 1;
        for (int i = 0; i < excess; i++) {
            active.get(i).revoke(now, REASON_LIMIT_EXCEEDED);
        }
        if (excess > 0) {
            log.info("Closed {} least recently used session(s) of user {} to stay within {}",
                    excess, userId, maxSessionsPerUser);
        }
    }

    private String normalizeDeviceInfo(String rawDeviceInfo) {
        if (rawDeviceInfo == null) {
            return null;
        }
        String trimmed = rawDeviceInfo.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > DEVICE_INFO_MAX_LENGTH ? trimmed.substring(0, DEVICE_INFO_MAX_LENGTH) : trimmed;
    }
}
