package com.jmapmail.mapper;

import com.jmapmail.domain.CanonicalMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CanonicalMessageMapper tests against SQLite
 */
class CanonicalMessageMapperTest {

    private static final Instant NOW = Instant.parse("2024-05-10T00:00:00Z");

    @TempDir
    Path tempDir;

    private CanonicalMessageMapper canonicalMessageMapper;

    @BeforeEach
    void setUp() throws Exception {
        canonicalMessageMapper = SqliteMappers.open(tempDir).mapper(CanonicalMessageMapper.class);
    }

    private static CanonicalMessage message(String id) {
        return CanonicalMessage.builder()
                .id(id)
                .ingestId("i".repeat(64))
                .rawBlobSha256("r".repeat(64))
                .messageId("m1@example.com")
                .subject("Hello")
                .size(120)
                .createdAt(NOW)
                .build();
    }

    @Test
    @DisplayName("Second insert with the same ingestId is ignored and the first row stays")
    void testIdempotentInsert() {
        assertThat(canonicalMessageMapper.insertIgnore(message("C1"))).isEqualTo(1);
        assertThat(canonicalMessageMapper.insertIgnore(message("C2"))).isZero();

        CanonicalMessage stored = canonicalMessageMapper.findByIngestId("i".repeat(64));
        assertThat(stored.getId()).isEqualTo("C1");
        assertThat(stored.getSubject()).isEqualTo("Hello");
        assertThat(canonicalMessageMapper.findById("C2")).isNull();
    }
}
