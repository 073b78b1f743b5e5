package com.qualitrack.backend.modules.credential.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * The pre-BCrypt password format: hex SHA-256 of the UTF-8 password, no salt.
 */
public final class LegacyPasswordDigest {

    private LegacyPasswordDigest() {
    }

    public static String digest(String rawPassword) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(rawPassword.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Constant-time comparison of the submitted password against a stored digest.
     */
    public static boolean matches(String rawPassword, String storedDigest) {
        if (rawPassword == null || storedDigest == null) {
            return false;
        }
        byte[] expected = storedDigest.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = digest(rawPassword).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }
}
