package com.qualitrack.backend.modules.session.application;

import java.time.OffsetDateTime;

import com.qualitrack.backend.modules.session.domain.UserSession;

public record SessionView(
        Long sessionId,
        Long userId,
        String login,
        boolean rememberMe,
        String deviceInfo,
        OffsetDateTime issuedAt,
        OffsetDateTime expiresAt,
        OffsetDateTime lastActivityAt,
        OffsetDateTime revokedAt,
        String revokedReason,
        boolean active
) {

    static SessionView from(UserSession session, OffsetDateTime now) {
        return new SessionView(
                session.getId(),
                session.getUser().getId(),
                session.getUser().getLogin(),
                session.isRememberMe(),
                session.getDeviceInfo(),
                session.getIssuedAt(),
                session.getExpiresAt(),
                session.getLastActivityAt(),
                session.getRevokedAt(),
                session.getRevokedReason(),
                session.isActiveAt(now)
        );
    }
}
