package com.qualitrack.backend.modules.session.application;

import java.time.OffsetDateTime;

/**
 * A freshly opened session. {@code token} is the only copy of the bearer token; it is not stored.
 */
public record IssuedSession(
        Long sessionId,
        Long userId,
        String token,
        boolean rememberMe,
        OffsetDateTime expiresAt
) {
}
