package com.qualitrack.backend.modules.credential.domain;

/**
 * Which password representation is authoritative for an account, or was used for a verification.
 */
public enum CredentialFormat {
    /** Unsalted SHA-256 hex digest, accepted only until the account is upgraded. */
    LEGACY,
    /** BCrypt hash. The only format written for new or changed passwords. */
    ADAPTIVE,
    NONE
}
