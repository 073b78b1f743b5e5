package com.qualitrack.backend.modules.authorization.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.qualitrack.backend.global.error.AuthenticationException;
import com.qualitrack.backend.global.error.StorageException;
import com.qualitrack.backend.modules.audit.application.AuditEvent;
import com.qualitrack.backend.modules.audit.application.AuditSink;
import com.qualitrack.backend.modules.audit.domain.AuditOutcome;
import com.qualitrack.backend.modules.authorization.domain.AuthenticatedSession;
import com.qualitrack.backend.modules.authorization.domain.Identity;
import com.qualitrack.backend.modules.authorization.domain.ResolvedAccess;
import com.qualitrack.backend.modules.credential.application.CredentialStore;
import com.qualitrack.backend.modules.credential.application.CredentialVerification;
import com.qualitrack.backend.modules.session.application.IssuedSession;
import com.qualitrack.backend.modules.session.application.SessionService;
import com.qualitrack.backend.modules.session.application.SessionView;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Login, logout and password change on top of the credential store and the session store.
 * Every attempt is audited; callers only ever see the generic authentication error.
 */
@Service
public class AuthenticationService {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);

    static final String LOGIN_ACTION = "auth.login";
    static final String LOGOUT_ACTION = "auth.logout";
    static final String PASSWORD_CHANGE_ACTION = "auth.password_change";
    static final String OTHER_SESSIONS_CLOSE_ACTION = "auth.sessions_close_others";

    private final CredentialStore credentialStore;
    private final SessionService sessionService;
    private final PermissionCache permissionCache;
    private final AuditSink auditSink;
    private final Clock clock;

    public AuthenticationService(
            CredentialStore credentialStore,
            SessionService sessionService,
            PermissionCache permissionCache,
            AuditSink auditSink,
            Clock clock
    ) {
        this.credentialStore = credentialStore;
        this.sessionService = sessionService;
        this.permissionCache = permissionCache;
        this.auditSink = auditSink;
        this.clock = clock;
    }

    public Identity authenticate(String login, String password) {
        CredentialVerification verification = verifyOrReject(login, password);
        return completeLogin(verification, Map.of("format", verification.formatUsed().name()));
    }

    /**
     * Authenticates and opens a session. {@code rememberMe} selects the long session lifetime.
     */
    public AuthenticatedSession login(String login, String password, boolean rememberMe, String deviceInfo) {
        CredentialVerification verification = verifyOrReject(login, password);
        IssuedSession session;
        try {
            session = sessionService.openSession(verification.userId(), rememberMe, deviceInfo);
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to open session", ex);
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("format", verification.formatUsed().name());
        detail.put("sessionId", session.sessionId());
        detail.put("rememberMe", rememberMe);
        Identity identity = completeLogin(verification, detail);
        return new AuthenticatedSession(identity, session.sessionId(), session.token(), rememberMe, session.expiresAt());
    }

    /**
     * Identity behind an open session. Unknown, closed and expired tokens all fail the same way.
     */
    public Identity authenticateBySessionToken(String token) {
        SessionView session;
        try {
            session = sessionService.validateSession(token).orElseThrow(AuthenticationException::invalidSession);
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to validate session", ex);
        }
        ResolvedAccess access = permissionCache.getOrResolveAccess(session.userId());
        log.debug("User {} authenticated by session {}", session.login(), session.sessionId());
        return Identity.of(session.userId(), session.login(), access);
    }

    /**
     * Changes the password and closes every session of the account, so the old password
     * cannot keep a session alive.
     */
    public void changePassword(String login, String oldPassword, String newPassword) {
        Long userId;
        int closedSessions;
        try {
            userId = credentialStore.changePassword(login, oldPassword, newPassword);
            closedSessions = sessionService.invalidateAllUserSessions(userId, SessionService.REASON_PASSWORD_CHANGED);
        } catch (AuthenticationException ex) {
            audit(null, login, PASSWORD_CHANGE_ACTION, AuditOutcome.FAILURE, Map.of());
            throw ex;
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to change password", ex);
        }
        permissionCache.invalidate(userId);
        audit(userId, login, PASSWORD_CHANGE_ACTION, AuditOutcome.SUCCESS, Map.of("sessionsClosed", closedSessions));
        log.info("Password changed for {}", login);
    }

    /**
     * Ends every session of the user.
     */
    public void logout(Identity identity) {
        logout(identity, null);
    }

    /**
     * Ends the session holding {@code sessionToken}, or every session of the user when no token
     * is given. The cached permissions are dropped either way.
     */
    public void logout(Identity identity, String sessionToken) {
        Objects.requireNonNull(identity, "identity is required");
        int closed;
        try {
            closed = sessionToken != null
                    ? (sessionService.invalidateSession(identity.userId(), sessionToken, SessionService.REASON_LOGOUT) ? 1 : 0)
                    : sessionService.invalidateAllUserSessions(identity.userId(), SessionService.REASON_LOGOUT);
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to close session", ex);
        }
        permissionCache.invalidate(identity.userId());
        audit(identity.userId(), identity.login(), LOGOUT_ACTION, AuditOutcome.SUCCESS,
                Map.of("scope", sessionToken != null ? "current" : "all", "sessionsClosed", closed));
    }

    /**
     * Keeps the caller's current session and closes the others.
     */
    public int closeOtherSessions(Identity identity, String currentToken) {
        Objects.requireNonNull(identity, "identity is required");
        int closed;
        try {
            closed = sessionService.invalidateOtherSessions(identity.userId(), currentToken);
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to close sessions", ex);
        }
        audit(identity.userId(), identity.login(), OTHER_SESSIONS_CLOSE_ACTION, AuditOutcome.SUCCESS,
                Map.of("sessionsClosed", closed));
        return closed;
    }

    private CredentialVerification verifyOrReject(String login, String password) {
        CredentialVerification verification;
        try {
            verification = credentialStore.verify(login, password);
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to verify credentials", ex);
        }
        if (!verification.ok()) {
            audit(verification.userId(), login, LOGIN_ACTION, AuditOutcome.FAILURE,
                    Map.of("format", verification.formatUsed().name()));
            throw new AuthenticationException();
        }
        return verification;
    }

    private Identity completeLogin(CredentialVerification verification, Map<String, Object> detail) {
        ResolvedAccess access = permissionCache.getOrResolveAccess(verification.userId());
        audit(verification.userId(), verification.login(), LOGIN_ACTION, AuditOutcome.SUCCESS, detail);
        log.debug("User {} authenticated with {} credential", verification.login(), verification.formatUsed());
        return Identity.of(verification.userId(), verification.login(), access);
    }

    private void audit(Long userId, String login, String action, AuditOutcome outcome, Map<String, Object> detail) {
        auditSink.record(new AuditEvent(userId, login, action, login, outcome, detail, OffsetDateTime.now(clock)));
    }
}
