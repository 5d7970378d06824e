package com.jmapmail.service;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.Account;
import com.jmapmail.domain.AccountMessage;
import com.jmapmail.domain.ChangeOp;
import com.jmapmail.domain.DeliveryStatus;
import com.jmapmail.domain.EmailSubmission;
import com.jmapmail.domain.Envelope;
import com.jmapmail.domain.JmapType;
import com.jmapmail.domain.SubmissionStatus;
import com.jmapmail.jmap.GetResponse;
import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.jmap.SetResponse;
import com.jmapmail.jmap.args.EmailSetArgs;
import com.jmapmail.jmap.args.EmailSubmissionCreate;
import com.jmapmail.jmap.args.EmailSubmissionSetArgs;
import com.jmapmail.jmap.args.GetArgs;
import com.jmapmail.mapper.AccountMapper;
import com.jmapmail.mapper.AccountMessageMapper;
import com.jmapmail.mapper.CanonicalMessageMapper;
import com.jmapmail.mapper.EmailSubmissionMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * EmailSubmission/get and EmailSubmission/set
 * - Create queues a PENDING row; the queue sends it after commit or on the next sweep
 * - Update only supports undoStatus "canceled" while the submission is still pending
 * - Destroy forgets the record, it does not recall mail
 * - onSuccessUpdateEmail / onSuccessDestroyEmail run as an implicit Email/set
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionService {

    private static final String UNDO_STATUS = "undoStatus";

    private final EmailSubmissionMapper submissionMapper;
    private final AccountMessageMapper accountMessageMapper;
    private final CanonicalMessageMapper canonicalMessageMapper;
    private final AccountMapper accountMapper;
    private final EmailSetService emailSetService;
    private final ChangeLogService changeLogService;
    private final SubmissionCodec submissionCodec;
    private final ApplicationEventPublisher eventPublisher;
    private final ServerProperties properties;
    private final Clock clock;

    public GetResponse get(String accountId, GetArgs args) {
        if (args.getIds() != null && args.getIds().size() > properties.getLimits().getMaxObjectsInGet()) {
            throw new JmapException(JmapErrorType.LIMIT_EXCEEDED,
                    "Too many ids, maximum is " + properties.getLimits().getMaxObjectsInGet());
        }
        String state = changeLogService.getState(accountId, JmapType.EMAIL_SUBMISSION);

        List<Map<String, Object>> list = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        if (args.getIds() == null) {
            for (EmailSubmission submission : submissionMapper.findByAccount(accountId)) {
                list.add(MailboxService.filter(toJmap(submission), args.getProperties()));
            }
        } else {
            for (String id : args.getIds()) {
                EmailSubmission submission = submissionMapper.findByAccountAndId(accountId, id);
                if (submission == null) {
                    notFound.add(id);
                } else {
                    list.add(MailboxService.filter(toJmap(submission), args.getProperties()));
                }
            }
        }
        return new GetResponse(accountId, state, list, notFound);
    }

    /**
     * EmailSubmission/set: creates, updates, destroys, then the onSuccess Email/set
     */
    @Transactional(noRollbackFor = JmapException.class)
    public SetResponse set(String accountId, EmailSubmissionSetArgs args, InvocationContext context) {
        if (args.objectCount() > properties.getLimits().getMaxObjectsInSet()) {
            throw new JmapException(JmapErrorType.LIMIT_EXCEEDED,
                    "Too many objects, maximum is " + properties.getLimits().getMaxObjectsInSet());
        }
        changeLogService.assertInState(accountId, JmapType.EMAIL_SUBMISSION, args.getIfInState());
        SetResponse response = new SetResponse(accountId,
                changeLogService.getState(accountId, JmapType.EMAIL_SUBMISSION));

        // submission key (id or #creationId) -> email id, for onSuccess*
        Map<String, String> succeeded = new LinkedHashMap<>();

        if (args.getCreate() != null) {
            for (Map.Entry<String, EmailSubmissionCreate> entry : args.getCreate().entrySet()) {
                try {
                    EmailSubmission submission = create(accountId, entry.getValue(), context);
                    context.putCreatedId(entry.getKey(), submission.getId());
                    succeeded.put("#" + entry.getKey(), submission.getEmailId());
                    response.addCreated(entry.getKey(), createdView(submission));
                } catch (JmapException e) {
                    response.addNotCreated(entry.getKey(), e.toSetError());
                }
            }
        }
        if (args.getUpdate() != null) {
            for (Map.Entry<String, Map<String, Object>> entry : args.getUpdate().entrySet()) {
                try {
                    EmailSubmission submission = update(accountId, context.resolveId(entry.getKey()), entry.getValue());
                    succeeded.put(entry.getKey(), submission.getEmailId());
                    response.addUpdated(entry.getKey(), null);
                } catch (JmapException e) {
                    response.addNotUpdated(entry.getKey(), e.toSetError());
                }
            }
        }
        if (args.getDestroy() != null) {
            for (String id : args.getDestroy()) {
                try {
                    destroy(accountId, context.resolveId(id));
                    response.addDestroyed(id);
                } catch (JmapException e) {
                    response.addNotDestroyed(id, e.toSetError());
                }
            }
        }

        response.setNewState(changeLogService.getState(accountId, JmapType.EMAIL_SUBMISSION));
        applyOnSuccess(accountId, args, succeeded, context);
        return response;
    }

    /**
     * Validate and queue one submission
     */
    EmailSubmission create(String accountId, EmailSubmissionCreate create, InvocationContext context) {
        if (create.getEmailId() == null) {
            throw JmapException.invalidProperties("emailId is required", "emailId");
        }
        String emailId = context.resolveId(create.getEmailId());
        AccountMessage email = emailId == null ? null : accountMessageMapper.findById(accountId, emailId);
        if (email == null || email.isDeleted()) {
            throw JmapException.invalidProperties("Email not found: " + create.getEmailId(), "emailId");
        }

        Envelope envelope = create.getEnvelope() != null
                ? create.getEnvelope()
                : defaultEnvelope(accountId, email);
        if (!envelope.isValid()) {
            throw JmapException.invalidProperties("Envelope needs mailFrom and at least one rcptTo", "envelope");
        }

        Instant now = clock.instant();
        Instant sendAt = create.getSendAt() != null && create.getSendAt().isAfter(now) ? create.getSendAt() : now;
        EmailSubmission submission = EmailSubmission.builder()
                .id(UUID.randomUUID().toString())
                .accountId(accountId)
                .emailId(emailId)
                .identityId(create.getIdentityId())
                .threadId(email.getThreadId())
                .envelopeJson(submissionCodec.writeEnvelope(envelope))
                .sendAt(sendAt)
                .deliveryStatusJson(submissionCodec.encode(SubmissionCodec.initial(envelope.getRecipientEmails())))
                .undoStatus("pending")
                .status(SubmissionStatus.PENDING)
                .nextAttemptAt(sendAt)
                .retryCount(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        submissionMapper.insert(submission);
        changeLogService.record(accountId, JmapType.EMAIL_SUBMISSION, submission.getId(), ChangeOp.CREATE);
        eventPublisher.publishEvent(new SubmissionQueuedEvent(submission.getId()));

        log.info("Submission queued: account={}, id={}, email={}, recipients={}",
                accountId, submission.getId(), emailId, envelope.getRecipientEmails().size());
        return submission;
    }

    /**
     * Only {"undoStatus": "canceled"} is accepted
     */
    EmailSubmission update(String accountId, String id, Map<String, Object> patch) {
        EmailSubmission submission = id == null ? null : submissionMapper.findByAccountAndId(accountId, id);
        if (submission == null) {
            throw JmapException.notFound("EmailSubmission not found: " + id);
        }
        for (Map.Entry<String, Object> change : patch.entrySet()) {
            if (!UNDO_STATUS.equals(change.getKey())) {
                throw JmapException.invalidProperties("Property cannot be changed: " + change.getKey(), change.getKey());
            }
            if (!"canceled".equals(change.getValue())) {
                throw JmapException.invalidProperties("undoStatus can only be set to canceled", UNDO_STATUS);
            }
        }
        if (patch.isEmpty()) {
            return submission;
        }

        if (submissionMapper.cancel(submission.getId(), clock.instant()) == 0) {
            throw new JmapException(JmapErrorType.CANNOT_UNSEND,
                    "Submission is " + submission.getStatus().name().toLowerCase() + " and can no longer be canceled");
        }
        changeLogService.record(accountId, JmapType.EMAIL_SUBMISSION, submission.getId(), ChangeOp.UPDATE,
                List.of(UNDO_STATUS));
        log.info("Submission canceled: account={}, id={}", accountId, submission.getId());
        return submission;
    }

    void destroy(String accountId, String id) {
        EmailSubmission submission = id == null ? null : submissionMapper.findByAccountAndId(accountId, id);
        if (submission == null) {
            throw JmapException.notFound("EmailSubmission not found: " + id);
        }
        submissionMapper.deleteById(submission.getId());
        changeLogService.record(accountId, JmapType.EMAIL_SUBMISSION, submission.getId(), ChangeOp.DESTROY);
    }

    private Envelope defaultEnvelope(String accountId, AccountMessage email) {
        Account account = accountMapper.findById(accountId);
        if (account == null) {
            throw new JmapException(JmapErrorType.ACCOUNT_NOT_FOUND, "Account not found: " + accountId);
        }
        List<String> recipients = canonicalMessageMapper.findRecipientEmails(email.getMessageId());
        if (recipients.isEmpty()) {
            throw JmapException.invalidProperties("Email has no recipients", "envelope");
        }
        return Envelope.of(account.getAddress(), recipients);
    }

    private void applyOnSuccess(String accountId, EmailSubmissionSetArgs args, Map<String, String> succeeded,
                                InvocationContext context) {
        Map<String, Map<String, Object>> updates = new LinkedHashMap<>();
        if (args.getOnSuccessUpdateEmail() != null) {
            for (Map.Entry<String, Map<String, Object>> entry : args.getOnSuccessUpdateEmail().entrySet()) {
                String emailId = succeeded.get(entry.getKey());
                if (emailId != null) {
                    updates.put(emailId, entry.getValue());
                }
            }
        }
        List<String> destroys = new ArrayList<>();
        if (args.getOnSuccessDestroyEmail() != null) {
            for (String key : args.getOnSuccessDestroyEmail()) {
                String emailId = succeeded.get(key);
                if (emailId != null && !destroys.contains(emailId)) {
                    destroys.add(emailId);
                }
            }
        }
        if (updates.isEmpty() && destroys.isEmpty()) {
            return;
        }

        EmailSetArgs emailSet = new EmailSetArgs();
        emailSet.setAccountId(accountId);
        emailSet.setUpdate(updates.isEmpty() ? null : updates);
        emailSet.setDestroy(destroys.isEmpty() ? null : destroys);
        try {
            context.addImplicitResponse("Email/set", emailSetService.set(accountId, emailSet, context));
        } catch (JmapException e) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("type", e.getType());
            error.put("description", e.getMessage());
            context.addImplicitResponse("error", error);
        }
    }

    private Map<String, Object> createdView(EmailSubmission submission) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", submission.getId());
        view.put("threadId", submission.getThreadId());
        view.put("sendAt", submission.getSendAt());
        view.put(UNDO_STATUS, submission.getUndoStatus());
        return view;
    }

    Map<String, Object> toJmap(EmailSubmission submission) {
        Envelope envelope = submissionCodec.readEnvelope(submission.getEnvelopeJson());
        List<String> recipients = envelope == null ? List.of() : envelope.getRecipientEmails();
        Map<String, DeliveryStatus> deliveryStatus =
                submissionCodec.decode(submission.getDeliveryStatusJson(), recipients);

        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", submission.getId());
        view.put("identityId", submission.getIdentityId());
        view.put("emailId", submission.getEmailId());
        view.put("threadId", submission.getThreadId());
        view.put("envelope", envelope);
        view.put("sendAt", submission.getSendAt());
        view.put(UNDO_STATUS, submission.getUndoStatus());
        view.put("deliveryStatus", deliveryStatus);
        view.put("dsnBlobIds", List.of());
        view.put("mdnBlobIds", List.of());
        return view;
    }
}
