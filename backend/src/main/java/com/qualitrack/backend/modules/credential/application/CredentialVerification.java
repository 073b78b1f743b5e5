package com.qualitrack.backend.modules.credential.application;

import com.qualitrack.backend.modules.credential.domain.CredentialFormat;

/**
 * Outcome of a password check. {@code formatUsed} is the representation that was compared,
 * {@code NONE} when the login is unknown, inactive or has no credential at all.
 */
public record CredentialVerification(boolean ok, CredentialFormat formatUsed, Long userId, String login) {

    public static CredentialVerification accepted(CredentialFormat formatUsed, Long userId, String login) {
        return new CredentialVerification(true, formatUsed, userId, login);
    }

    public static CredentialVerification rejected(CredentialFormat formatUsed, Long userId, String login) {
        return new CredentialVerification(false, formatUsed, userId, login);
    }

    public static CredentialVerification unknown() {
        return new CredentialVerification(false, CredentialFormat.NONE, null, null);
    }
}
