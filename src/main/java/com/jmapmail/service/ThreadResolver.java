package com.jmapmail.service;

import com.jmapmail.domain.MailThread;
import com.jmapmail.mapper.ThreadMapper;
import com.jmapmail.util.EmlParser;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Conversation thread resolution
 * - In-Reply-To match first
 * - Then the earliest known message among References
 * - Otherwise a new thread
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThreadResolver {

    private final ThreadMapper threadMapper;
    private final Clock clock;

    @Data
    @AllArgsConstructor
    public static class Resolution {
        private String threadId;
        private boolean created;
    }

    /**
     * Resolve the thread of a new message, creating one if no correlated message is known
     */
    @Transactional
    public Resolution resolveOrCreateThreadId(String accountId, String subject, Instant internalDate,
                                              String inReplyTo, String referencesHeader) {
        return resolveOrCreateThreadId(accountId, subject, internalDate, inReplyTo,
                EmlParser.parseReferences(referencesHeader));
    }

    /**
     * Same as above with an already parsed References list
     */
    @Transactional
    public Resolution resolveOrCreateThreadId(String accountId, String subject, Instant internalDate,
                                              String inReplyTo, List<String> references) {
        Instant now = clock.instant();

        String parentId = EmlParser.normalizeMessageId(inReplyTo);
        if (parentId != null) {
            String threadId = threadMapper.findThreadIdByMessageId(accountId, parentId);
            if (threadId != null) {
                threadMapper.updateLatestMessageAt(threadId, internalDate, now);
                log.debug("Thread {} matched by In-Reply-To {}", threadId, parentId);
                return new Resolution(threadId, false);
            }
        }

        if (references != null && !references.isEmpty()) {
            String threadId = threadMapper.findEarliestThreadIdByMessageIds(accountId, references);
            if (threadId != null) {
                threadMapper.updateLatestMessageAt(threadId, internalDate, now);
                log.debug("Thread {} matched by References", threadId);
                return new Resolution(threadId, false);
            }
        }

        MailThread thread = MailThread.builder()
                .id(UUID.randomUUID().toString())
                .accountId(accountId)
                .subject(subject)
                .latestMessageAt(internalDate)
                .createdAt(now)
                .updatedAt(now)
                .build();
        threadMapper.insert(thread);
        log.debug("New thread {} for account {}", thread.getId(), accountId);
        return new Resolution(thread.getId(), true);
    }

    /**
     * Add a message to a known thread (copies keep the source's thread)
     */
    @Transactional
    public Resolution join(String threadId, Instant internalDate) {
        threadMapper.updateLatestMessageAt(threadId, internalDate, clock.instant());
        return new Resolution(threadId, false);
    }
}
