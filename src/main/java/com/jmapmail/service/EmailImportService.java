package com.jmapmail.service;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.AccountMessage;
import com.jmapmail.domain.CanonicalMessage;
import com.jmapmail.domain.JmapType;
import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.jmap.SetResponse;
import com.jmapmail.jmap.args.EmailImportArgs;
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
 * Email/import: ingest blobs the account uploaded, through the same path as inbound mail
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailImportService {

    private final BlobService blobService;
    private final IngestionService ingestionService;
    private final EmailSetService emailSetService;
    private final ChangeLogService changeLogService;
    private final ServerProperties properties;
    private final Clock clock;

    @Transactional(noRollbackFor = JmapException.class)
    public SetResponse importEmails(String accountId, EmailImportArgs args, InvocationContext context) {
        if (args.getEmails() == null || args.getEmails().isEmpty()) {
            throw JmapException.invalidArguments("emails must contain at least one entry");
        }
        if (args.getEmails().size() > properties.getLimits().getMaxObjectsInSet()) {
            throw new JmapException(JmapErrorType.LIMIT_EXCEEDED,
                    "Too many objects, maximum is " + properties.getLimits().getMaxObjectsInSet());
        }
        changeLogService.assertInState(accountId, JmapType.EMAIL, args.getIfInState());
        SetResponse response = new SetResponse(accountId, changeLogService.getState(accountId, JmapType.EMAIL));

        for (Map.Entry<String, EmailImportArgs.ImportEntry> entry : args.getEmails().entrySet()) {
            try {
                AccountMessage message = importOne(accountId, entry.getValue(), context);
                context.putCreatedId(entry.getKey(), message.getId());
                response.addCreated(entry.getKey(), createdView(message));
            } catch (JmapException e) {
                response.addNotCreated(entry.getKey(), e.toSetError());
            }
        }

        response.setNewState(changeLogService.getState(accountId, JmapType.EMAIL));
        return response;
    }

    AccountMessage importOne(String accountId, EmailImportArgs.ImportEntry entry, InvocationContext context) {
        if (entry.getBlobId() == null) {
            throw JmapException.invalidProperties("blobId is required", "blobId");
        }
        List<String> mailboxIds = emailSetService.resolveMailboxes(accountId, entry.getMailboxIds(), context);
        KeywordSupport.Split keywords = KeywordSupport.split(entry.getKeywords());

        String blobId = context.resolveId(entry.getBlobId());
        byte[] raw = blobId == null ? null : blobService.readForAccount(accountId, blobId);
        if (raw == null) {
            throw new JmapException(JmapErrorType.BLOB_NOT_FOUND, "Blob not found: " + entry.getBlobId(),
                    List.of("blobId"));
        }

        IngestionService.PreparedMessage prepared;
        try {
            prepared = ingestionService.prepare(raw);
        } catch (IllegalArgumentException e) {
            throw JmapException.invalidProperties("Blob is not a parseable message", "blobId");
        }
        emailSetService.checkAttachmentSize(prepared.getAttachmentSize());

        CanonicalMessage canonical = ingestionService.upsertCanonicalMessage(prepared);
        Instant receivedAt = entry.getReceivedAt() != null ? entry.getReceivedAt() : clock.instant();
        AccountMessage message = ingestionService.ingestForAccount(accountId, canonical, mailboxIds, keywords,
                receivedAt);
        log.info("Email imported: account={}, id={}, blob={}", accountId, message.getId(), blobId);
        return message;
    }

    private Map<String, Object> createdView(AccountMessage message) {
        CanonicalMessage canonical = ingestionService.findCanonical(message.getMessageId());
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", message.getId());
        view.put("blobId", canonical == null ? null : canonical.getRawBlobSha256());
        view.put("threadId", message.getThreadId());
        view.put("size", canonical == null ? 0 : canonical.getSize());
        return view;
    }
}
