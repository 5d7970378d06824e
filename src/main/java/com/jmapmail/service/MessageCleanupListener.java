package com.jmapmail.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Runs canonical cleanup once the destroying transaction has committed.
 * Failures are logged; maintenance picks up what is left.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MessageCleanupListener {

    private final MessageCleanupService cleanupService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onEmailsDestroyed(EmailsDestroyedEvent event) {
        for (String messageId : event.getCanonicalMessageIds()) {
            try {
                cleanupService.cleanupCanonical(messageId);
            } catch (Exception e) {
                log.error("Canonical cleanup after commit failed for {}", messageId, e);
            }
        }
    }
}
