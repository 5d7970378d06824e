package com.jmapmail.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.DeliveryNotification;
import com.jmapmail.service.SubmissionStateService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * SES event webhook (delivered through SNS)
 * - Accepts a bare SNS envelope, an array of {Sns: ...} records or {Records: [...]}
 * - Every envelope is signature-checked before anything else
 * - SubscriptionConfirmation is confirmed by fetching its SubscribeURL
 * - Notifications from an unexpected topic are dropped
 */
@Slf4j
@Service
public class SesWebhookService {

    private final SnsSignatureVerifier signatureVerifier;
    private final SigningCertificateCache certificateCache;
    private final SubmissionStateService stateService;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final ServerProperties properties;

    public SesWebhookService(SnsSignatureVerifier signatureVerifier,
                             SigningCertificateCache certificateCache,
                             SubmissionStateService stateService,
                             @Qualifier("snsRestClient") RestClient restClient,
                             ObjectMapper objectMapper,
                             ServerProperties properties) {
        this.signatureVerifier = signatureVerifier;
        this.certificateCache = certificateCache;
        this.stateService = stateService;
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * @return number of notifications applied to a submission
     */
    public int process(JsonNode body) {
        int processed = 0;
        for (JsonNode sns : envelopes(body)) {
            try {
                if (handle(sns)) {
                    processed++;
                }
            } catch (Exception e) {
                log.error("SNS record processing failed: messageId={}", SnsSignatureVerifier.text(sns, "MessageId"), e);
            }
        }
        return processed;
    }

    boolean handle(JsonNode sns) {
        if (properties.getWebhook().isVerifySignature() && !signatureVerifier.verify(sns)) {
            log.warn("SNS signature verification failed: messageId={}", SnsSignatureVerifier.text(sns, "MessageId"));
            return false;
        }
        // Topic is checked before any message type, subscription confirmations included
        String topicArn = SnsSignatureVerifier.text(sns, "TopicArn");
        String expectedTopic = properties.getWebhook().getTopicArn();
        if (topicArn == null || !topicArn.equals(expectedTopic)) {
            log.warn("Unexpected SES topic: {}", topicArn);
            return false;
        }

        String type = SnsSignatureVerifier.text(sns, "Type");
        if ("SubscriptionConfirmation".equals(type)) {
            confirmSubscription(sns);
            return false;
        }
        if (type != null && !"Notification".equals(type)) {
            return false;
        }

        JsonNode event = parseMessage(sns);
        if (event == null) {
            return false;
        }
        DeliveryNotification notification = SesEventMapper.map(event);
        if (notification == null) {
            log.debug("Ignoring SES event type {}", SesEventMapper.eventType(event));
            return false;
        }
        if (notification.getSubmissionId() == null && notification.getProviderMessageId() == null) {
            return false;
        }
        return stateService.applyNotification(notification);
    }

    private void confirmSubscription(JsonNode sns) {
        String subscribeUrl = SnsSignatureVerifier.text(sns, "SubscribeURL");
        if (subscribeUrl == null || !certificateCache.isTrustedUrl(subscribeUrl)) {
            log.warn("Refusing SNS subscription confirmation URL: {}", subscribeUrl);
            return;
        }
        try {
            restClient.get().uri(subscribeUrl).retrieve().toBodilessEntity();
            log.info("SNS subscription confirmed for topic {}", properties.getWebhook().getTopicArn());
        } catch (RestClientException e) {
            log.error("SNS subscription confirmation failed", e);
        }
    }

    private JsonNode parseMessage(JsonNode sns) {
        String message = SnsSignatureVerifier.text(sns, "Message");
        if (message == null) {
            return null;
        }
        try {
            JsonNode event = objectMapper.readTree(message);
            return event != null && event.isObject() ? event : null;
        } catch (JsonProcessingException e) {
            log.warn("Unparseable SNS message: {}", e.getOriginalMessage());
            return null;
        }
    }

    static List<JsonNode> envelopes(JsonNode body) {
        List<JsonNode> envelopes = new ArrayList<>();
        if (body == null) {
            return envelopes;
        }
        JsonNode records = body.isArray() ? body : body.get("Records");
        if (records != null && records.isArray()) {
            for (JsonNode record : records) {
                JsonNode sns = record.get("Sns");
                if (sns != null && sns.path("Message").isTextual()) {
                    envelopes.add(sns);
                }
            }
        } else if (body.isObject() && body.path("Message").isTextual()) {
            envelopes.add(body);
        }
        return envelopes;
    }
}
