package com.jmapmail.service;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.Blob;
import com.jmapmail.domain.CanonicalMessage;
import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.mapper.BlobMapper;
import com.jmapmail.mapper.CanonicalMessageMapper;
import com.jmapmail.mapper.SqliteMappers;
import com.jmapmail.storage.FileSystemBlobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BlobService tests over SQLite mappers and the file system store
 */
class BlobServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-10T00:00:00Z");

    @TempDir
    Path tempDir;

    private FileSystemBlobStore blobStore;
    private BlobMapper blobMapper;
    private CanonicalMessageMapper canonicalMessageMapper;
    private ServerProperties properties;
    private BlobService blobService;

    @BeforeEach
    void setUp() throws Exception {
        SqliteMappers mappers = SqliteMappers.open(tempDir);
        blobMapper = mappers.mapper(BlobMapper.class);
        canonicalMessageMapper = mappers.mapper(CanonicalMessageMapper.class);
        blobStore = new FileSystemBlobStore(tempDir.resolve("blobs"));
        properties = new ServerProperties();
        blobService = serviceAt(NOW);
    }

    private BlobService serviceAt(Instant instant) {
        return new BlobService(blobStore, blobMapper, properties, Clock.fixed(instant, ZoneOffset.UTC));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Upload stores the bytes and grants only the uploading account")
    void testUpload() {
        Blob blob = blobService.upload("acc", bytes("hello"));

        assertThat(blob.getSize()).isEqualTo(5);
        assertThat(blobService.readForAccount("acc", blob.getSha256())).isEqualTo(bytes("hello"));
        assertThat(blobService.readForAccount("other", blob.getSha256())).isNull();
        assertThat(blobMapper.findBySha256(blob.getSha256())).isNotNull();
    }

    @Test
    @DisplayName("Empty and oversized uploads are rejected")
    void testUploadLimits() {
        properties.getLimits().setMaxSizeUpload(4);

        assertThatThrownBy(() -> blobService.upload("acc", new byte[0]))
                .isInstanceOf(JmapException.class)
                .extracting("type").isEqualTo(JmapErrorType.INVALID_ARGUMENTS);
        assertThatThrownBy(() -> blobService.upload("acc", bytes("hello")))
                .isInstanceOf(JmapException.class)
                .extracting("type").isEqualTo(JmapErrorType.LIMIT_EXCEEDED);
    }

    @Test
    @DisplayName("Orphan sweep removes old ungranted blobs and keeps old uploads that are still granted")
    void testSweepOrphans() {
        BlobService threeDaysAgo = serviceAt(NOW.minus(3, ChronoUnit.DAYS));
        Blob uploaded = threeDaysAgo.upload("acc", bytes("pending upload"));
        Blob orphan = threeDaysAgo.store(bytes("left behind"));
        Blob fresh = blobService.store(bytes("just stored"));

        assertThat(blobService.sweepOrphans(10)).isEqualTo(1);

        assertThat(blobService.exists(orphan.getSha256())).isFalse();
        assertThat(blobMapper.findBySha256(orphan.getSha256())).isNull();
        assertThat(blobService.readForAccount("acc", uploaded.getSha256())).isEqualTo(bytes("pending upload"));
        assertThat(blobService.exists(fresh.getSha256())).isTrue();
    }

    @Test
    @DisplayName("Blobs still referenced by a canonical message survive deleteIfUnreferenced")
    void testDeleteIfUnreferenced() {
        Blob referenced = blobService.store(bytes("raw message"));
        Blob loose = blobService.store(bytes("loose"));
        canonicalMessageMapper.insertIgnore(CanonicalMessage.builder()
                .id("C1").ingestId("i".repeat(64)).rawBlobSha256(referenced.getSha256())
                .size(11).createdAt(NOW).build());

        List<String> deleted = blobService.deleteIfUnreferenced(List.of(referenced.getSha256(), loose.getSha256()));

        assertThat(deleted).containsExactly(loose.getSha256());
        assertThat(blobService.exists(referenced.getSha256())).isTrue();
        assertThat(blobService.exists(loose.getSha256())).isFalse();
    }
}
