package com.jmapmail.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CryptoUtil unit tests
 */
class CryptoUtilTest {

    @Test
    @DisplayName("SHA-256 hex of a known input")
    void testSha256Hex() {
        String hash = CryptoUtil.sha256Hex("abc");

        assertThat(hash).hasSize(64); // SHA-256 is 64 hex characters
        assertThat(hash).isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("secureEquals compares secrets and rejects null")
    void testSecureEquals() {
        assertThat(CryptoUtil.secureEquals("token", "token")).isTrue();
        assertThat(CryptoUtil.secureEquals("token", "tokem")).isFalse();
        assertThat(CryptoUtil.secureEquals("token", null)).isFalse();
    }

    @Test
    @DisplayName("Strip angle brackets (<>)")
    void testStripAngleBrackets() {
        assertThat(CryptoUtil.stripAngleBrackets("<user@test.com>")).isEqualTo("user@test.com");
        assertThat(CryptoUtil.stripAngleBrackets("user@test.com")).isEqualTo("user@test.com");
        assertThat(CryptoUtil.stripAngleBrackets("<user@test.com")).isEqualTo("user@test.com");
        assertThat(CryptoUtil.stripAngleBrackets(null)).isNull();
    }

    @Test
    @DisplayName("Normalize email: trimmed, unbracketed, lowercase")
    void testNormalizeEmail() {
        assertThat(CryptoUtil.normalizeEmail(" <User@Example.COM> ")).isEqualTo("user@example.com");
        assertThat(CryptoUtil.normalizeEmail("  ")).isNull();
        assertThat(CryptoUtil.normalizeEmail(null)).isNull();
    }

    @Test
    @DisplayName("Extract email domain")
    void testExtractDomain() {
        assertThat(CryptoUtil.extractDomain("user@example.com")).isEqualTo("example.com");
        assertThat(CryptoUtil.extractDomain("user@EXAMPLE.COM")).isEqualTo("example.com");
        assertThat(CryptoUtil.extractDomain("noatsign")).isNull();
        assertThat(CryptoUtil.extractDomain(null)).isNull();
    }
}
