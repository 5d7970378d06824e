package com.jmapmail.queue;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.service.SubmissionQueuedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jms.JmsException;
import org.springframework.jms.core.JmsTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

/**
 * ActiveMQ producer
 * - Submission queue: ids of freshly queued submissions, for prompt dispatch
 * - Inbound queue: raw inbound messages with their recipients
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MailQueueProducer {

    private final JmsTemplate jmsTemplate;
    private final ServerProperties properties;

    public void enqueueSubmission(String submissionId) {
        String destination = properties.getQueue().getSubmissionDestination();
        jmsTemplate.send(destination, session -> {
            var message = session.createTextMessage(submissionId);
            message.setStringProperty("submissionId", submissionId);
            return message;
        });
        log.debug("Submission enqueued: {}", submissionId);
    }

    public void enqueueInbound(byte[] emlData, List<String> recipients) {
        String destination = properties.getQueue().getInboundDestination();
        jmsTemplate.send(destination, session -> {
            var message = session.createBytesMessage();
            message.writeBytes(emlData);
            message.setStringProperty("recipients", String.join(",", recipients));
            return message;
        });
        log.info("Mail enqueued to inbound: {} bytes -> {}", emlData.length, recipients);
    }

    /**
     * Dispatch once the inserting transaction is visible; the sweep covers a lost message
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onSubmissionQueued(SubmissionQueuedEvent event) {
        try {
            enqueueSubmission(event.getSubmissionId());
        } catch (JmsException e) {
            log.error("Prompt dispatch failed for submission {}; left to the sweep", event.getSubmissionId(), e);
        }
    }
}
