package com.jmapmail.service;

import com.jmapmail.mapper.AccountMessageMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Periodic housekeeping
 * - Finishes canonical cleanups interrupted after a destroy
 * - Deletes blobs nothing references once they are past the grace period
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MaintenanceService {

    static final int BATCH_SIZE = 100;

    private final AccountMessageMapper accountMessageMapper;
    private final MessageCleanupService cleanupService;
    private final BlobService blobService;

    public void runMaintenance() {
        int messages = resumeCanonicalCleanup();
        int blobs = blobService.sweepOrphans(BATCH_SIZE);
        if (messages > 0 || blobs > 0) {
            log.info("Maintenance: canonical messages removed={}, orphan blobs removed={}", messages, blobs);
        }
    }

    /**
     * Each canonical message is cleaned in its own transaction; one failure does not stop the rest
     */
    int resumeCanonicalCleanup() {
        List<String> pending = accountMessageMapper.findUnreferencedMessageIds(BATCH_SIZE);
        int removed = 0;
        for (String messageId : pending) {
            try {
                if (cleanupService.cleanupCanonical(messageId)) {
                    removed++;
                }
            } catch (Exception e) {
                log.error("Canonical cleanup failed for {}", messageId, e);
            }
        }
        return removed;
    }
}
