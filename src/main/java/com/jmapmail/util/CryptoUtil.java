package com.jmapmail.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Hashing and address utilities
 */
public final class CryptoUtil {

    private CryptoUtil() {}

    /**
     * SHA-256 hex digest of raw bytes (blob ids, ingest ids)
     */
    public static String sha256Hex(byte[] input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input));
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * SHA-256 hex digest of a UTF-8 string
     */
    public static String sha256Hex(String input) {
        return sha256Hex(input.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Constant-time comparison of two secrets
     */
    public static boolean secureEquals(String expected, String actual) {
        if (expected == null || actual == null) return false;
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Strip angle brackets (<>) from an address or Message-ID
     */
    public static String stripAngleBrackets(String value) {
        if (value == null) return null;
        String stripped = value.trim();
        if (stripped.startsWith("<")) stripped = stripped.substring(1);
        if (stripped.endsWith(">")) stripped = stripped.substring(0, stripped.length() - 1);
        return stripped.trim();
    }

    /**
     * Lowercase, trimmed email address; null for blank input
     */
    public static String normalizeEmail(String email) {
        if (email == null) return null;
        String trimmed = stripAngleBrackets(email);
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * Extract domain from an email address
     */
    public static String extractDomain(String email) {
        if (email == null || !email.contains("@")) return null;
        return email.substring(email.lastIndexOf('@') + 1).toLowerCase(Locale.ROOT);
    }
}
