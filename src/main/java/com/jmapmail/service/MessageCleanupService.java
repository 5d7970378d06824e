package com.jmapmail.service;

import com.jmapmail.domain.AccountMessage;
import com.jmapmail.domain.Attachment;
import com.jmapmail.domain.CanonicalMessage;
import com.jmapmail.domain.ChangeOp;
import com.jmapmail.domain.JmapType;
import com.jmapmail.mapper.AccountMessageMapper;
import com.jmapmail.mapper.CanonicalMessageMapper;
import com.jmapmail.mapper.ThreadMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Email destroy cascade
 * - Soft delete: flag row, drop memberships and keywords, destroy or update the thread
 * - Canonical cleanup after commit: metadata first, stored blobs last
 * Each stage is idempotent so an interrupted cleanup can be resumed by maintenance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageCleanupService {

    private final AccountMessageMapper accountMessageMapper;
    private final ThreadMapper threadMapper;
    private final CanonicalMessageMapper canonicalMessageMapper;
    private final BlobService blobService;
    private final ChangeLogService changeLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Soft-delete one account message inside the caller's transaction
     * @return mailbox ids the message was removed from
     */
    @Transactional
    public List<String> softDelete(AccountMessage message) {
        Instant now = clock.instant();
        String accountId = message.getAccountId();
        List<String> mailboxIds = accountMessageMapper.findMailboxIds(message.getId());

        accountMessageMapper.markDeleted(message.getId(), now);
        accountMessageMapper.deleteMemberships(message.getId());
        accountMessageMapper.deleteKeywords(message.getId());
        changeLogService.record(accountId, JmapType.EMAIL, message.getId(), ChangeOp.DESTROY);

        String threadId = message.getThreadId();
        if (threadMapper.countLiveMessages(threadId) == 0) {
            threadMapper.deleteById(threadId);
            changeLogService.record(accountId, JmapType.THREAD, threadId, ChangeOp.DESTROY);
        } else {
            changeLogService.record(accountId, JmapType.THREAD, threadId, ChangeOp.UPDATE, List.of("emailIds"));
        }

        for (String mailboxId : mailboxIds) {
            changeLogService.record(accountId, JmapType.MAILBOX, mailboxId, ChangeOp.UPDATE,
                    MailboxService.COUNT_PROPERTIES);
        }

        eventPublisher.publishEvent(new EmailsDestroyedEvent(List.of(message.getMessageId())));
        log.debug("Email soft-deleted: account={}, email={}", accountId, message.getId());
        return mailboxIds;
    }

    /**
     * Remove a canonical message nobody references any more, with its headers,
     * addresses, attachments and unreferenced blobs
     * @return true if the canonical message was removed
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean cleanupCanonical(String canonicalMessageId) {
        if (accountMessageMapper.countLiveByMessageId(canonicalMessageId) > 0) {
            return false;
        }
        accountMessageMapper.deleteSoftDeletedByMessageId(canonicalMessageId);

        CanonicalMessage message = canonicalMessageMapper.findById(canonicalMessageId);
        if (message == null) {
            return false;
        }

        List<String> blobIds = new ArrayList<>();
        blobIds.add(message.getRawBlobSha256());
        for (Attachment attachment : canonicalMessageMapper.findAttachments(canonicalMessageId)) {
            blobIds.add(attachment.getBlobSha256());
        }

        canonicalMessageMapper.deleteHeaders(canonicalMessageId);
        canonicalMessageMapper.deleteAddresses(canonicalMessageId);
        canonicalMessageMapper.deleteAttachments(canonicalMessageId);
        canonicalMessageMapper.deleteById(canonicalMessageId);

        List<String> deletedBlobs = blobService.deleteIfUnreferenced(blobIds);
        log.info("Canonical message removed: id={}, blobs deleted={}", canonicalMessageId, deletedBlobs.size());
        return true;
    }
}
