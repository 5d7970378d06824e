package com.jmapmail.service;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.AccountMessage;
import com.jmapmail.domain.CanonicalMessage;
import com.jmapmail.domain.ChangeOp;
import com.jmapmail.domain.JmapType;
import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.jmap.SetResponse;
import com.jmapmail.jmap.args.EmailCreate;
import com.jmapmail.jmap.args.EmailSetArgs;
import com.jmapmail.mapper.AccountMessageMapper;
import com.jmapmail.mapper.MailboxMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Email engine: Email/set create, update and destroy
 * - Create from an uploaded blob or from draft fields, both through the ingestion pipeline
 * - Update applies mailboxIds / keywords patches, touching only changed rows
 * - Destroy is a soft delete; canonical cleanup runs after commit
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailSetService {

    private static final String MAILBOX_IDS = "mailboxIds";
    private static final String KEYWORDS = "keywords";

    private final AccountMessageMapper accountMessageMapper;
    private final MailboxMapper mailboxMapper;
    private final IngestionService ingestionService;
    private final BlobService blobService;
    private final DraftMimeBuilder draftMimeBuilder;
    private final MessageCleanupService cleanupService;
    private final ChangeLogService changeLogService;
    private final ServerProperties properties;
    private final Clock clock;

    /**
     * Email/set: creates, then updates, then destroys, in one transaction
     */
    @Transactional(noRollbackFor = JmapException.class)
    public SetResponse set(String accountId, EmailSetArgs args, InvocationContext context) {
        if (args.objectCount() > properties.getLimits().getMaxObjectsInSet()) {
            throw new JmapException(JmapErrorType.LIMIT_EXCEEDED,
                    "Too many objects, maximum is " + properties.getLimits().getMaxObjectsInSet());
        }
        changeLogService.assertInState(accountId, JmapType.EMAIL, args.getIfInState());
        SetResponse response = new SetResponse(accountId, changeLogService.getState(accountId, JmapType.EMAIL));

        if (args.getCreate() != null) {
            for (Map.Entry<String, EmailCreate> entry : args.getCreate().entrySet()) {
                try {
                    AccountMessage message = create(accountId, entry.getValue(), context);
                    context.putCreatedId(entry.getKey(), message.getId());
                    response.addCreated(entry.getKey(), createdView(message));
                } catch (JmapException e) {
                    response.addNotCreated(entry.getKey(), e.toSetError());
                }
            }
        }
        if (args.getUpdate() != null) {
            for (Map.Entry<String, Map<String, Object>> entry : args.getUpdate().entrySet()) {
                try {
                    update(accountId, context.resolveId(entry.getKey()), entry.getValue(), context);
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

        response.setNewState(changeLogService.getState(accountId, JmapType.EMAIL));
        return response;
    }

    /**
     * Create one email; every check runs before the first write
     */
    AccountMessage create(String accountId, EmailCreate create, InvocationContext context) {
        List<String> mailboxIds = resolveMailboxes(accountId, create.getMailboxIds(), context);
        KeywordSupport.Split keywords = KeywordSupport.split(create.getKeywords());

        byte[] raw;
        if (create.getBlobId() != null) {
            if (create.isDraftFields()) {
                throw JmapException.invalidProperties("blobId cannot be combined with draft fields", "blobId");
            }
            raw = blobService.readForAccount(accountId, create.getBlobId());
            if (raw == null) {
                throw JmapException.invalidProperties("Blob not found: " + create.getBlobId(), "blobId");
            }
        } else if (create.isDraftFields()) {
            raw = buildDraft(accountId, create);
        } else {
            throw JmapException.invalidProperties("Either blobId or draft fields are required", "blobId");
        }

        IngestionService.PreparedMessage prepared;
        try {
            prepared = ingestionService.prepare(raw);
        } catch (IllegalArgumentException e) {
            throw JmapException.invalidProperties("Message could not be parsed", "blobId");
        }
        checkAttachmentSize(prepared.getAttachmentSize());

        CanonicalMessage canonical = ingestionService.upsertCanonicalMessage(prepared);
        Instant receivedAt = create.getReceivedAt() != null ? create.getReceivedAt() : clock.instant();
        AccountMessage message = ingestionService.ingestForAccount(accountId, canonical, mailboxIds, keywords, receivedAt);
        log.info("Email created: account={}, id={}, thread={}", accountId, message.getId(), message.getThreadId());
        return message;
    }

    private byte[] buildDraft(String accountId, EmailCreate create) {
        if (create.getTextBody() == null && create.getHtmlBody() == null) {
            throw JmapException.invalidProperties("Either textBody or htmlBody must be provided", "textBody");
        }
        Map<String, byte[]> attachmentData = new HashMap<>();
        long total = 0;
        if (create.getAttachments() != null) {
            for (EmailCreate.AttachmentRef ref : create.getAttachments()) {
                byte[] data = ref.getBlobId() == null ? null : blobService.readForAccount(accountId, ref.getBlobId());
                if (data == null) {
                    throw JmapException.invalidProperties("Attachment blob not found: " + ref.getBlobId(), "attachments");
                }
                attachmentData.put(ref.getBlobId(), data);
                total += data.length;
            }
        }
        checkAttachmentSize(total);
        return draftMimeBuilder.build(create, attachmentData);
    }

    void checkAttachmentSize(long total) {
        long limit = properties.getLimits().getMaxSizeAttachmentsPerEmail();
        if (total > limit) {
            throw new JmapException(JmapErrorType.LIMIT_EXCEEDED,
                    "Attachments exceed " + limit + " bytes", List.of("attachments"));
        }
    }

    List<String> resolveMailboxes(String accountId, Map<String, Boolean> requested,
                                          InvocationContext context) {
        if (requested == null) {
            throw JmapException.invalidProperties("mailboxIds must be provided", MAILBOX_IDS);
        }
        Set<String> resolved = new LinkedHashSet<>();
        for (Map.Entry<String, Boolean> entry : requested.entrySet()) {
            if (entry.getValue() == null) {
                throw JmapException.invalidProperties("mailboxIds must contain booleans", MAILBOX_IDS);
            }
            if (!entry.getValue()) {
                continue;
            }
            resolved.add(requireMailbox(accountId, entry.getKey(), context));
        }
        if (resolved.isEmpty()) {
            throw JmapException.invalidProperties("mailboxIds must include at least one mailbox", MAILBOX_IDS);
        }
        checkMailboxCap(resolved.size());
        return new ArrayList<>(resolved);
    }

    private String requireMailbox(String accountId, String idRef, InvocationContext context) {
        String id = context == null ? idRef : context.resolveId(idRef);
        if (id == null || mailboxMapper.findById(accountId, id) == null) {
            throw JmapException.invalidProperties("Mailbox not found: " + idRef, MAILBOX_IDS);
        }
        return id;
    }

    private void checkMailboxCap(int count) {
        int cap = properties.getLimits().getMaxMailboxesPerEmail();
        if (count > cap) {
            throw new JmapException(JmapErrorType.LIMIT_EXCEEDED,
                    "An email can be in at most " + cap + " mailboxes", List.of(MAILBOX_IDS));
        }
    }

    /**
     * Apply a patch; accepts "mailboxIds" / "keywords" maps (true adds, false removes)
     * and "mailboxIds/<id>" / "keywords/<kw>" pointers (true adds, null or false removes)
     * @return true if anything changed
     */
    @Transactional(noRollbackFor = JmapException.class)
    public boolean update(String accountId, String id, Map<String, Object> patch) {
        return update(accountId, id, patch, null);
    }

    /**
     * @param context resolves "#creationId" mailbox keys created earlier in the request; may be null
     */
    @Transactional(noRollbackFor = JmapException.class)
    public boolean update(String accountId, String id, Map<String, Object> patch, InvocationContext context) {
        AccountMessage message = id == null ? null : accountMessageMapper.findById(accountId, id);
        if (message == null) {
            throw JmapException.notFound("Email not found: " + id);
        }

        Map<String, Boolean> requestedMailboxes = new LinkedHashMap<>();
        Map<String, Boolean> keywordPatch = new LinkedHashMap<>();
        parsePatch(patch, requestedMailboxes, keywordPatch);
        Map<String, Boolean> mailboxPatch = resolveMailboxKeys(requestedMailboxes, context);

        // Validate everything before writing
        List<String> current = accountMessageMapper.findMailboxIds(id);
        Set<String> added = new LinkedHashSet<>();
        Set<String> removed = new LinkedHashSet<>();
        if (!mailboxPatch.isEmpty()) {
            Set<String> result = new LinkedHashSet<>(current);
            for (Map.Entry<String, Boolean> entry : mailboxPatch.entrySet()) {
                if (entry.getValue()) {
                    if (!current.contains(entry.getKey())) {
                        requireMailbox(accountId, entry.getKey(), null);
                        added.add(entry.getKey());
                    }
                    result.add(entry.getKey());
                }
            }
            for (Map.Entry<String, Boolean> entry : mailboxPatch.entrySet()) {
                if (!entry.getValue() && result.remove(entry.getKey()) && current.contains(entry.getKey())) {
                    removed.add(entry.getKey());
                }
            }
            added.removeAll(removed);
            if (result.isEmpty()) {
                throw JmapException.invalidProperties("Email must remain in at least one mailbox", MAILBOX_IDS);
            }
            checkMailboxCap(result.size());
        }

        AccountMessage flags = message.toBuilder().build();
        Set<String> customAdd = new LinkedHashSet<>();
        Set<String> customRemove = new LinkedHashSet<>();
        if (!keywordPatch.isEmpty()) {
            List<String> currentCustom = accountMessageMapper.findKeywords(id);
            for (Map.Entry<String, Boolean> entry : keywordPatch.entrySet()) {
                String keyword = KeywordSupport.normalize(entry.getKey());
                boolean value = entry.getValue();
                switch (keyword) {
                    case KeywordSupport.SEEN -> flags.setSeen(value);
                    case KeywordSupport.FLAGGED -> flags.setFlagged(value);
                    case KeywordSupport.ANSWERED -> flags.setAnswered(value);
                    case KeywordSupport.DRAFT -> flags.setDraft(value);
                    default -> {
                        if (value && !currentCustom.contains(keyword)) {
                            customAdd.add(keyword);
                            customRemove.remove(keyword);
                        } else if (!value && currentCustom.contains(keyword)) {
                            customRemove.add(keyword);
                            customAdd.remove(keyword);
                        }
                    }
                }
            }
        }

        Instant now = clock.instant();
        List<String> changedProperties = new ArrayList<>();
        Set<String> touchedMailboxes = new LinkedHashSet<>();

        if (!added.isEmpty() || !removed.isEmpty()) {
            for (String mailboxId : added) {
                accountMessageMapper.insertMembership(id, mailboxId, now);
            }
            for (String mailboxId : removed) {
                accountMessageMapper.deleteMembership(id, mailboxId);
            }
            touchedMailboxes.addAll(added);
            touchedMailboxes.addAll(removed);
            changedProperties.add(MAILBOX_IDS);
        }

        boolean flagsChanged = flags.isSeen() != message.isSeen() || flags.isFlagged() != message.isFlagged()
                || flags.isAnswered() != message.isAnswered() || flags.isDraft() != message.isDraft();
        if (flagsChanged) {
            flags.setUpdatedAt(now);
            accountMessageMapper.updateFlags(flags);
            if (flags.isSeen() != message.isSeen()) {
                // Unread counts of every containing mailbox change
                touchedMailboxes.addAll(accountMessageMapper.findMailboxIds(id));
            }
        }
        for (String keyword : customAdd) {
            accountMessageMapper.insertKeywordIgnore(id, keyword);
        }
        for (String keyword : customRemove) {
            accountMessageMapper.deleteKeyword(id, keyword);
        }
        if (flagsChanged || !customAdd.isEmpty() || !customRemove.isEmpty()) {
            changedProperties.add(KEYWORDS);
        }

        if (changedProperties.isEmpty()) {
            return false;
        }
        if (!flagsChanged) {
            accountMessageMapper.touch(id, now);
        }

        changeLogService.record(accountId, JmapType.EMAIL, id, ChangeOp.UPDATE, changedProperties);
        if (changedProperties.contains(MAILBOX_IDS)) {
            changeLogService.record(accountId, JmapType.THREAD, message.getThreadId(), ChangeOp.UPDATE,
                    List.of("emailIds"));
        }
        for (String mailboxId : touchedMailboxes) {
            changeLogService.record(accountId, JmapType.MAILBOX, mailboxId, ChangeOp.UPDATE,
                    MailboxService.COUNT_PROPERTIES);
        }
        log.debug("Email updated: account={}, id={}, properties={}", accountId, id, changedProperties);
        return true;
    }

    private Map<String, Boolean> resolveMailboxKeys(Map<String, Boolean> mailboxPatch, InvocationContext context) {
        Map<String, Boolean> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Boolean> entry : mailboxPatch.entrySet()) {
            String id = context == null ? entry.getKey() : context.resolveId(entry.getKey());
            if (id == null) {
                throw JmapException.invalidProperties("Mailbox not found: " + entry.getKey(), MAILBOX_IDS);
            }
            resolved.put(id, entry.getValue());
        }
        return resolved;
    }

    private void parsePatch(Map<String, Object> patch, Map<String, Boolean> mailboxPatch,
                            Map<String, Boolean> keywordPatch) {
        for (Map.Entry<String, Object> entry : patch.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (MAILBOX_IDS.equals(key) || KEYWORDS.equals(key)) {
                if (!(value instanceof Map<?, ?> map)) {
                    throw JmapException.invalidProperties(key + " must be an object", key);
                }
                Map<String, Boolean> target = MAILBOX_IDS.equals(key) ? mailboxPatch : keywordPatch;
                for (Map.Entry<?, ?> item : map.entrySet()) {
                    if (!(item.getValue() instanceof Boolean flag)) {
                        throw JmapException.invalidProperties(key + " values must be booleans", key);
                    }
                    target.put(String.valueOf(item.getKey()), flag);
                }
            } else if (key.startsWith(MAILBOX_IDS + "/") || key.startsWith(KEYWORDS + "/")) {
                String property = key.substring(0, key.indexOf('/'));
                String member = key.substring(key.indexOf('/') + 1);
                if (member.isEmpty() || (value != null && !(value instanceof Boolean))) {
                    throw JmapException.invalidProperties("Invalid patch " + key, property);
                }
                Map<String, Boolean> target = MAILBOX_IDS.equals(property) ? mailboxPatch : keywordPatch;
                target.put(member, Boolean.TRUE.equals(value));
            } else {
                throw JmapException.invalidProperties("Property cannot be updated: " + key, key);
            }
        }
    }

    /**
     * Soft-delete one email of the account
     */
    @Transactional(noRollbackFor = JmapException.class)
    public void destroy(String accountId, String id) {
        AccountMessage message = id == null ? null : accountMessageMapper.findById(accountId, id);
        if (message == null) {
            throw JmapException.notFound("Email not found: " + id);
        }
        cleanupService.softDelete(message);
        log.info("Email destroyed: account={}, id={}", accountId, id);
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
