package com.jmapmail.storage;

import com.jmapmail.config.ServerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.regex.Pattern;

/**
 * File-system blob store
 * Path structure: basePath/ab/cd/abcdef... (first two byte pairs of the hash)
 */
@Slf4j
@Component
public class FileSystemBlobStore implements BlobStore {

    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-f]{64}");

    private final Path basePath;

    @Autowired
    public FileSystemBlobStore(ServerProperties properties) {
        this(Paths.get(properties.getStorage().getBlobPath()));
    }

    public FileSystemBlobStore(Path basePath) {
        this.basePath = basePath;
    }

    /**
     * Relative key for a hash: ab/cd/abcd...
     */
    public static String storageKey(String sha256) {
        return sha256.substring(0, 2) + "/" + sha256.substring(2, 4) + "/" + sha256;
    }

    @Override
    public String put(String sha256, byte[] data) throws IOException {
        Path target = resolve(sha256);
        if (Files.exists(target)) {
            return storageKey(sha256);
        }
        Files.createDirectories(target.getParent());

        // Write to a temp file first so readers never see a partial object
        Path temp = Files.createTempFile(target.getParent(), sha256, ".tmp");
        try {
            Files.write(temp, data);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Blob stored: {} ({} bytes)", sha256, data.length);
        return storageKey(sha256);
    }

    @Override
    public byte[] get(String sha256) throws IOException {
        Path path = resolve(sha256);
        if (!Files.exists(path)) {
            return null;
        }
        return Files.readAllBytes(path);
    }

    @Override
    public boolean exists(String sha256) {
        return Files.exists(resolve(sha256));
    }

    @Override
    public boolean delete(String sha256) {
        try {
            return Files.deleteIfExists(resolve(sha256));
        } catch (IOException e) {
            log.error("Failed to delete blob: {}", sha256, e);
            return false;
        }
    }

    private Path resolve(String sha256) {
        if (sha256 == null || !SHA256_HEX.matcher(sha256).matches()) {
            throw new IllegalArgumentException("Invalid blob id: " + sha256);
        }
        return basePath.resolve(storageKey(sha256));
    }
}
