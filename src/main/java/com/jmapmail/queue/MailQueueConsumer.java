package com.jmapmail.queue;

import com.jmapmail.service.InboundDeliveryService;
import com.jmapmail.service.SubmissionQueueService;
import jakarta.jms.BytesMessage;
import jakarta.jms.Message;
import jakarta.jms.TextMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jms.annotation.JmsListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * ActiveMQ consumer
 * - Submission queue: same claim/send path as the sweep; the claim decides who sends
 * - Inbound queue: delivery into local accounts
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MailQueueConsumer {

    private final SubmissionQueueService submissionQueueService;
    private final InboundDeliveryService inboundDeliveryService;

    @JmsListener(destination = "${jmapmail.queue.submission-destination:jmap.submission.queue}")
    public void processSubmission(Message message) {
        try {
            if (!(message instanceof TextMessage textMessage)) {
                log.warn("Unexpected message type in submission queue");
                return;
            }
            String submissionId = textMessage.getText();
            boolean attempted = submissionQueueService.processSubmission(submissionId);
            log.debug("Submission {} dispatched from queue, attempted={}", submissionId, attempted);
        } catch (Exception e) {
            log.error("Error processing submission queue message", e);
        }
    }

    @JmsListener(destination = "${jmapmail.queue.inbound-destination:mail.inbound.queue}")
    public void processInbound(Message message) {
        try {
            if (!(message instanceof BytesMessage bytesMessage)) {
                log.warn("Unexpected message type in inbound queue");
                return;
            }

            byte[] emlData = new byte[(int) bytesMessage.getBodyLength()];
            bytesMessage.readBytes(emlData);
            List<String> recipients = splitRecipients(bytesMessage.getStringProperty("recipients"));

            log.info("Processing inbound mail for {}", recipients);
            inboundDeliveryService.deliver(emlData, recipients);
        } catch (Exception e) {
            log.error("Error processing inbound queue message", e);
        }
    }

    static List<String> splitRecipients(String header) {
        List<String> recipients = new ArrayList<>();
        if (header == null) {
            return recipients;
        }
        for (String part : header.split(",")) {
            if (!part.isBlank()) {
                recipients.add(part.trim());
            }
        }
        return recipients;
    }
}
