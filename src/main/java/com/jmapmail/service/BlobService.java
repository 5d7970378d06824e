package com.jmapmail.service;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.Blob;
import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.mapper.BlobMapper;
import com.jmapmail.storage.BlobStore;
import com.jmapmail.util.CryptoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.io.IOException;
import java.time.Instant;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Blob metadata and storage coordination
 * - Content addressed by SHA-256
 * - Per-account read grants (account_blob)
 * - Storage deletes run after the metadata transaction commits
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlobService {

    private final BlobStore blobStore;
    private final BlobMapper blobMapper;
    private final ServerProperties properties;
    private final Clock clock;

    /**
     * Store bytes and their metadata row (idempotent on the hash)
     */
    @Transactional
    public Blob store(byte[] data) {
        String sha256 = CryptoUtil.sha256Hex(data);
        try {
            String storageKey = blobStore.put(sha256, data);
            Blob blob = Blob.builder()
                    .sha256(sha256)
                    .size(data.length)
                    .storageKey(storageKey)
                    .createdAt(clock.instant())
                    .build();
            blobMapper.insertIgnore(blob);
            return blob;
        } catch (IOException e) {
            log.error("Failed to store blob {}", sha256, e);
            throw new RuntimeException("Blob store failed", e);
        }
    }

    /**
     * Store bytes and grant the account read access
     */
    @Transactional
    public Blob storeForAccount(String accountId, byte[] data) {
        Blob blob = store(data);
        grant(accountId, blob.getSha256());
        return blob;
    }

    /**
     * Client upload: size-limited, granted to the uploading account
     */
    @Transactional
    public Blob upload(String accountId, byte[] data) {
        if (data == null || data.length == 0) {
            throw JmapException.invalidArguments("Empty upload");
        }
        if (data.length > properties.getLimits().getMaxSizeUpload()) {
            throw new JmapException(JmapErrorType.LIMIT_EXCEEDED,
                    "Upload exceeds " + properties.getLimits().getMaxSizeUpload() + " bytes");
        }
        Blob blob = storeForAccount(accountId, data);
        log.info("Blob uploaded: account={}, blobId={}, size={}", accountId, blob.getSha256(), data.length);
        return blob;
    }

    public void grant(String accountId, String sha256) {
        blobMapper.insertAccountBlobIgnore(accountId, sha256, clock.instant());
    }

    public boolean canRead(String accountId, String sha256) {
        return blobMapper.countAccountBlob(accountId, sha256) > 0;
    }

    /**
     * Blob bytes if the account holds a grant, otherwise null
     */
    public byte[] readForAccount(String accountId, String sha256) {
        if (!isBlobId(sha256) || !canRead(accountId, sha256)) {
            return null;
        }
        return read(sha256);
    }

    /**
     * Blob bytes without a grant check; null when missing
     */
    public byte[] read(String sha256) {
        if (!isBlobId(sha256)) {
            return null;
        }
        try {
            return blobStore.get(sha256);
        } catch (IOException e) {
            log.error("Failed to read blob {}", sha256, e);
            throw new RuntimeException("Blob read failed", e);
        }
    }

    public boolean exists(String sha256) {
        return isBlobId(sha256) && blobStore.exists(sha256);
    }

    /**
     * Delete metadata of blobs nothing references any more;
     * the stored objects are removed once the transaction commits
     * @return hashes whose metadata was deleted
     */
    @Transactional
    public List<String> deleteIfUnreferenced(Collection<String> sha256s) {
        List<String> deleted = new ArrayList<>();
        for (String sha256 : new LinkedHashSet<>(sha256s)) {
            if (sha256 == null || blobMapper.countReferences(sha256) > 0) {
                continue;
            }
            blobMapper.deleteAccountBlobs(sha256);
            blobMapper.deleteBySha256(sha256);
            deleted.add(sha256);
        }
        deleteStoredAfterCommit(deleted);
        return deleted;
    }

    /**
     * Remove objects from storage after commit, or immediately outside a transaction.
     * Failures are logged and left for the orphan sweep.
     */
    public void deleteStoredAfterCommit(List<String> sha256s) {
        if (sha256s.isEmpty()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    deleteStored(sha256s);
                }
            });
        } else {
            deleteStored(sha256s);
        }
    }

    private void deleteStored(List<String> sha256s) {
        for (String sha256 : sha256s) {
            try {
                if (blobStore.delete(sha256)) {
                    log.debug("Blob object deleted: {}", sha256);
                }
            } catch (Exception e) {
                log.warn("Blob object delete failed, left for sweep: {}", sha256, e);
            }
        }
    }

    /**
     * Orphan sweep: unreferenced blobs older than the grace period
     */
    @Transactional
    public int sweepOrphans(int limit) {
        Instant cutoff = clock.instant().minusSeconds(properties.getMaintenance().getOrphanBlobGraceMinutes() * 60);
        List<String> orphans = new ArrayList<>();
        for (Blob blob : blobMapper.findOrphans(cutoff, limit)) {
            orphans.add(blob.getSha256());
        }
        return deleteIfUnreferenced(orphans).size();
    }

    public static boolean isBlobId(String value) {
        return value != null && value.matches("[0-9a-f]{64}");
    }
}
