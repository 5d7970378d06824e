package com.jmapmail.service;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.DeliveryStatus;
import com.jmapmail.domain.EmailSubmission;
import com.jmapmail.domain.Envelope;
import com.jmapmail.domain.SubmissionStatus;
import com.jmapmail.mapper.EmailSubmissionMapper;
import com.jmapmail.outbound.OutboundDeliveryService;
import com.jmapmail.outbound.OutboundRequest;
import com.jmapmail.outbound.OutboundResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outbound submission queue
 * - claim (transactional CAS) -> send (no transaction) -> complete (transactional)
 * - Transient failures are retried on the backoff table, then become FAILED
 * - The sweep processes due submissions sequentially, oldest first
 */
@Slf4j
@Service
public class SubmissionQueueService {

    private final EmailSubmissionMapper submissionMapper;
    private final SubmissionStateService stateService;
    private final OutboundDeliveryService deliveryService;
    private final SubmissionCodec submissionCodec;
    private final ServerProperties properties;
    private final Clock clock;

    private final Counter sentCounter;
    private final Counter failedCounter;
    private final Counter retryCounter;

    public SubmissionQueueService(EmailSubmissionMapper submissionMapper,
                                  SubmissionStateService stateService,
                                  OutboundDeliveryService deliveryService,
                                  SubmissionCodec submissionCodec,
                                  ServerProperties properties,
                                  Clock clock,
                                  MeterRegistry meterRegistry) {
        this.submissionMapper = submissionMapper;
        this.stateService = stateService;
        this.deliveryService = deliveryService;
        this.submissionCodec = submissionCodec;
        this.properties = properties;
        this.clock = clock;

        this.sentCounter = Counter.builder("jmap.submission.sent")
                .description("Submissions accepted by the outbound transport")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("jmap.submission.failed")
                .description("Submissions that ended in permanent failure")
                .register(meterRegistry);
        this.retryCounter = Counter.builder("jmap.submission.retry")
                .description("Send attempts rescheduled after a transient failure")
                .register(meterRegistry);
    }

    /**
     * Process up to sweepBatchSize due submissions, one at a time
     * @return number of submissions that were attempted
     */
    public int sweep() {
        List<String> dueIds = submissionMapper.findDueIds(clock.instant(), properties.getQueue().getSweepBatchSize());
        int attempted = 0;
        for (String id : dueIds) {
            try {
                if (processSubmission(id)) {
                    attempted++;
                }
            } catch (Exception e) {
                log.error("Submission {} processing failed", id, e);
            }
        }
        if (!dueIds.isEmpty()) {
            log.info("Submission sweep: due={}, attempted={}", dueIds.size(), attempted);
        }
        return attempted;
    }

    /**
     * Claim and attempt one submission
     * @return true if this caller made the attempt
     */
    public boolean processSubmission(String submissionId) {
        SubmissionStateService.Claim claim = stateService.claim(submissionId);
        switch (claim.getOutcome()) {
            case FAILED:
                failedCounter.increment();
                return false;
            case SKIPPED:
                return false;
            default:
                break;
        }
        EmailSubmission attempt = send(claim);
        stateService.complete(attempt);
        return true;
    }

    /**
     * Run the transport and compute the next row state; never throws for transport problems
     */
    EmailSubmission send(SubmissionStateService.Claim claim) {
        EmailSubmission submission = claim.getSubmission();
        Instant now = clock.instant();
        Envelope envelope = submissionCodec.readEnvelope(submission.getEnvelopeJson());
        List<String> recipients = envelope == null ? List.of() : envelope.getRecipientEmails();
        Map<String, DeliveryStatus> statuses = submissionCodec.decode(submission.getDeliveryStatusJson(), recipients);

        if (envelope == null || !envelope.isValid()) {
            failedCounter.increment();
            log.warn("Submission {} has an invalid envelope", submission.getId());
            return outcome(submission, now, SubmissionStatus.FAILED, submission.getRetryCount(), null,
                    statuses, recipients, DeliveryStatus.of(550, "5.5.4", "Invalid envelope",
                            DeliveryStatus.Delivered.NO), null);
        }

        int nextRetryCount = submission.getRetryCount() + 1;
        OutboundResult result;
        try {
            result = deliveryService.deliverBlocking(OutboundRequest.builder()
                    .accountId(submission.getAccountId())
                    .submissionId(submission.getId())
                    .emailId(submission.getEmailId())
                    .mailFrom(envelope.getMailFrom().getEmail())
                    .rcptTo(recipients)
                    .rawBlobSha256(claim.getRawBlobSha256())
                    .size(claim.getSize())
                    .build());
        } catch (Exception e) {
            log.warn("Submission {} attempt {} failed: {}", submission.getId(), nextRetryCount, e.toString());
            if (nextRetryCount > maxRetryAttempts()) {
                failedCounter.increment();
                return outcome(submission, now, SubmissionStatus.FAILED, nextRetryCount, null, statuses, recipients,
                        DeliveryStatus.of(550, "5.4.4", "Transport error", DeliveryStatus.Delivered.NO), null);
            }
            retryCounter.increment();
            return outcome(submission, now, SubmissionStatus.PENDING, nextRetryCount,
                    computeNextAttempt(nextRetryCount, now), statuses, recipients,
                    DeliveryStatus.of(451, "4.4.0", errorReason(e), DeliveryStatus.Delivered.QUEUED), null);
        }

        if (result.isAccepted()) {
            sentCounter.increment();
            DeliveryStatus accepted = DeliveryStatus.of(250, "2.0.0",
                    result.getReason() != null ? result.getReason() : "Accepted by outbound transport",
                    DeliveryStatus.Delivered.QUEUED).toBuilder()
                    .providerMessageId(result.getProviderMessageId())
                    .providerRequestId(result.getProviderRequestId())
                    .build();
            log.info("Submission {} sent after {} attempt(s)", submission.getId(), nextRetryCount);
            return outcome(submission, now, SubmissionStatus.SENT, nextRetryCount, null, statuses, recipients,
                    accepted, result.getProviderMessageId());
        }

        if (result.isPermanentRejection()) {
            failedCounter.increment();
            log.warn("Submission {} rejected permanently: {}", submission.getId(), result.getReason());
            return outcome(submission, now, SubmissionStatus.FAILED, nextRetryCount, null, statuses, recipients,
                    DeliveryStatus.of(550, "5.7.1", reasonOr(result, "Rejected by outbound transport"),
                            DeliveryStatus.Delivered.NO), result.getProviderMessageId());
        }

        if (nextRetryCount > maxRetryAttempts()) {
            failedCounter.increment();
            log.warn("Submission {} failed after {} attempts: {}", submission.getId(), nextRetryCount, result.getReason());
            return outcome(submission, now, SubmissionStatus.FAILED, nextRetryCount, null, statuses, recipients,
                    DeliveryStatus.of(550, "5.4.1", "Delivery failed after retries", DeliveryStatus.Delivered.NO),
                    result.getProviderMessageId());
        }
        retryCounter.increment();
        log.info("Submission {} deferred (attempt {}): {}", submission.getId(), nextRetryCount, result.getReason());
        return outcome(submission, now, SubmissionStatus.PENDING, nextRetryCount,
                computeNextAttempt(nextRetryCount, now), statuses, recipients,
                DeliveryStatus.of(451, "4.4.0", reasonOr(result, "Temporary delivery issue"),
                        DeliveryStatus.Delivered.QUEUED), result.getProviderMessageId());
    }

    /**
     * Attempt n (1-based) waits backoff[n-1]; later attempts reuse the last entry
     */
    Instant computeNextAttempt(int retryCount, Instant now) {
        List<Long> backoff = properties.getQueue().getBackoffSeconds();
        int idx = Math.max(0, Math.min(retryCount - 1, backoff.size() - 1));
        return now.plusSeconds(backoff.get(idx));
    }

    int maxRetryAttempts() {
        return properties.getQueue().getBackoffSeconds().size();
    }

    private EmailSubmission outcome(EmailSubmission submission, Instant now, SubmissionStatus status,
                                    int retryCount, Instant nextAttemptAt,
                                    Map<String, DeliveryStatus> current, List<String> recipients,
                                    DeliveryStatus deliveryStatus, String providerMessageId) {
        Map<String, DeliveryStatus> statuses = SubmissionCodec.apply(current, recipients, deliveryStatus);
        return submission.toBuilder()
                .status(status)
                .undoStatus("final")
                .retryCount(retryCount)
                .nextAttemptAt(nextAttemptAt)
                .lastAttemptAt(now)
                .deliveryStatusJson(submissionCodec.encode(statuses))
                .providerMessageId(providerMessageId)
                .updatedAt(now)
                .build();
    }

    private static String reasonOr(OutboundResult result, String fallback) {
        return result.getReason() == null || result.getReason().isBlank() ? fallback : result.getReason();
    }

    private static String errorReason(Exception e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
