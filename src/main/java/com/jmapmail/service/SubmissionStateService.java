package com.jmapmail.service;

import com.jmapmail.domain.AccountMessage;
import com.jmapmail.domain.CanonicalMessage;
import com.jmapmail.domain.ChangeOp;
import com.jmapmail.domain.DeliveryNotification;
import com.jmapmail.domain.DeliveryStatus;
import com.jmapmail.domain.EmailSubmission;
import com.jmapmail.domain.JmapType;
import com.jmapmail.domain.Mailbox;
import com.jmapmail.domain.SubmissionStatus;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.mapper.AccountMessageMapper;
import com.jmapmail.mapper.EmailSubmissionMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transactional steps of the submission queue
 * - claim: precondition checks and the PENDING -> SENDING compare-and-swap
 * - complete: persist the outcome of an attempt and finalize the email once sent
 * - applyNotification: provider reports, applied without claim/send
 * The network send runs between the two, outside any transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionStateService {

    static final List<String> STATUS_PROPERTIES = List.of("undoStatus", "deliveryStatus");

    private final EmailSubmissionMapper submissionMapper;
    private final AccountMessageMapper accountMessageMapper;
    private final IngestionService ingestionService;
    private final BlobService blobService;
    private final MailboxService mailboxService;
    private final EmailSetService emailSetService;
    private final ChangeLogService changeLogService;
    private final SubmissionCodec submissionCodec;
    private final Clock clock;

    public enum ClaimOutcome {
        CLAIMED, SKIPPED, FAILED
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Claim {
        private ClaimOutcome outcome;
        private EmailSubmission submission;
        private String rawBlobSha256;
        private long size;

        static Claim of(ClaimOutcome outcome) {
            return Claim.builder().outcome(outcome).build();
        }
    }

    /**
     * Claim a due submission for one send attempt.
     * Only the caller whose conditional update hits a row gets CLAIMED.
     */
    @Transactional
    public Claim claim(String submissionId) {
        Instant now = clock.instant();
        EmailSubmission submission = submissionMapper.findById(submissionId);
        if (submission == null
                || submission.getStatus() != SubmissionStatus.PENDING
                || "canceled".equals(submission.getUndoStatus())
                || submission.getNextAttemptAt() == null
                || submission.getNextAttemptAt().isAfter(now)) {
            return Claim.of(ClaimOutcome.SKIPPED);
        }

        AccountMessage email = accountMessageMapper.findById(submission.getAccountId(), submission.getEmailId());
        if (email == null || email.isDeleted() || email.getThreadId() == null) {
            return failBeforeSend(submission, DeliveryStatus.of(550, "5.2.0",
                    "Email deleted before sending", DeliveryStatus.Delivered.NO));
        }
        CanonicalMessage canonical = ingestionService.findCanonical(email.getMessageId());
        if (canonical == null || !blobService.exists(canonical.getRawBlobSha256())) {
            return failBeforeSend(submission, DeliveryStatus.of(550, "5.3.0",
                    "Email blob missing before sending", DeliveryStatus.Delivered.NO));
        }

        if (submissionMapper.markSending(submissionId, now) == 0) {
            log.debug("Submission {} claimed elsewhere", submissionId);
            return Claim.of(ClaimOutcome.SKIPPED);
        }
        changeLogService.record(submission.getAccountId(), JmapType.EMAIL_SUBMISSION, submissionId,
                ChangeOp.UPDATE, List.of("undoStatus"));

        return Claim.builder()
                .outcome(ClaimOutcome.CLAIMED)
                .submission(submission.toBuilder()
                        .status(SubmissionStatus.SENDING)
                        .undoStatus("final")
                        .updatedAt(now)
                        .build())
                .rawBlobSha256(canonical.getRawBlobSha256())
                .size(canonical.getSize())
                .build();
    }

    /**
     * Persist an attempt's outcome; a SENT submission also moves its email from drafts to sent
     * @return false when the row was no longer SENDING
     */
    @Transactional
    public boolean complete(EmailSubmission attempt) {
        if (submissionMapper.recordAttempt(attempt) == 0) {
            log.warn("Submission {} left SENDING before its outcome was recorded", attempt.getId());
            return false;
        }
        changeLogService.record(attempt.getAccountId(), JmapType.EMAIL_SUBMISSION, attempt.getId(),
                ChangeOp.UPDATE, STATUS_PROPERTIES);
        if (attempt.getStatus() == SubmissionStatus.SENT) {
            finalizeSentEmail(attempt.getAccountId(), attempt.getEmailId());
        }
        return true;
    }

    /**
     * Apply a provider notification; FAILED and CANCELED submissions are left alone
     * @return true if a submission was updated
     */
    @Transactional
    public boolean applyNotification(DeliveryNotification notification) {
        EmailSubmission submission = null;
        if (notification.getSubmissionId() != null) {
            submission = submissionMapper.findById(notification.getSubmissionId());
        }
        if (submission == null && notification.getProviderMessageId() != null) {
            submission = submissionMapper.findByProviderMessageId(notification.getProviderMessageId());
        }
        if (submission == null) {
            log.debug("No submission for notification: id={}, providerMessageId={}",
                    notification.getSubmissionId(), notification.getProviderMessageId());
            return false;
        }

        SubmissionStatus status = notification.getStatus() != null ? notification.getStatus() : submission.getStatus();
        String undoStatus = status == SubmissionStatus.PENDING ? submission.getUndoStatus() : "final";
        Map<String, DeliveryStatus> statuses = SubmissionCodec.apply(
                submissionCodec.decode(submission.getDeliveryStatusJson(), recipientsOf(submission)),
                notification.getRecipients(), notification.getDeliveryStatus());

        int updated = submissionMapper.applyNotification(submission.getId(), status, undoStatus,
                submissionCodec.encode(statuses), clock.instant());
        if (updated == 0) {
            log.info("Notification ignored for {} submission {}", submission.getStatus(), submission.getId());
            return false;
        }
        changeLogService.record(submission.getAccountId(), JmapType.EMAIL_SUBMISSION, submission.getId(),
                ChangeOp.UPDATE, STATUS_PROPERTIES);
        if (status == SubmissionStatus.SENT && submission.getStatus() != SubmissionStatus.SENT) {
            finalizeSentEmail(submission.getAccountId(), submission.getEmailId());
        }
        log.info("Notification applied: submission={}, status={} -> {}", submission.getId(), submission.getStatus(), status);
        return true;
    }

    /**
     * Drop the drafts membership and the $draft keyword, file the email under sent
     */
    void finalizeSentEmail(String accountId, String emailId) {
        Mailbox drafts = mailboxService.findByRole(accountId, "drafts");
        Mailbox sent = mailboxService.findByRole(accountId, "sent");
        List<String> current = accountMessageMapper.findMailboxIds(emailId);

        Map<String, Object> patch = new LinkedHashMap<>();
        if (sent != null && !current.contains(sent.getId())) {
            patch.put("mailboxIds/" + sent.getId(), Boolean.TRUE);
        }
        if (drafts != null && current.contains(drafts.getId()) && (sent != null || current.size() > 1)) {
            patch.put("mailboxIds/" + drafts.getId(), null);
        }
        patch.put("keywords/" + KeywordSupport.DRAFT, null);

        try {
            emailSetService.update(accountId, emailId, patch);
        } catch (JmapException e) {
            log.warn("Email {} not finalized after send: {}", emailId, e.getMessage());
        }
    }

    private Claim failBeforeSend(EmailSubmission submission, DeliveryStatus status) {
        List<String> recipients = recipientsOf(submission);
        Map<String, DeliveryStatus> statuses = SubmissionCodec.apply(
                submissionCodec.decode(submission.getDeliveryStatusJson(), recipients), null, status);
        int updated = submissionMapper.markFailedBeforeSend(submission.getId(),
                submissionCodec.encode(statuses), clock.instant());
        if (updated == 0) {
            return Claim.of(ClaimOutcome.SKIPPED);
        }
        changeLogService.record(submission.getAccountId(), JmapType.EMAIL_SUBMISSION, submission.getId(),
                ChangeOp.UPDATE, STATUS_PROPERTIES);
        log.warn("Submission {} failed before sending: {}", submission.getId(), status.getReason());
        return Claim.of(ClaimOutcome.FAILED);
    }

    private List<String> recipientsOf(EmailSubmission submission) {
        return submissionCodec.envelopeRecipients(submission.getEnvelopeJson());
    }
}
