package com.jmapmail.queue;

import com.jmapmail.service.MaintenanceService;
import com.jmapmail.service.SubmissionQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic triggers: the submission sweep and the maintenance pass
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubmissionScheduler {

    private final SubmissionQueueService submissionQueueService;
    private final MaintenanceService maintenanceService;

    @Scheduled(fixedDelayString = "${jmapmail.queue.sweep-interval-ms:30000}")
    public void sweepSubmissions() {
        try {
            submissionQueueService.sweep();
        } catch (Exception e) {
            log.error("Submission sweep failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${jmapmail.maintenance.interval-ms:3600000}",
            initialDelayString = "${jmapmail.maintenance.interval-ms:3600000}")
    public void runMaintenance() {
        try {
            maintenanceService.runMaintenance();
        } catch (Exception e) {
            log.error("Maintenance pass failed", e);
        }
    }
}
