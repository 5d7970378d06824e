package com.jmapmail.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jmapmail.domain.DeliveryStatus;
import com.jmapmail.domain.Envelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON columns of email_submission: the SMTP envelope and the per-recipient delivery status map
 * - Delivery status keys are recipient addresses as given in the envelope; lookups are case-insensitive
 * - Also reads the legacy shape {status, lastAttempt, retryCount}, either per recipient
 *   or as one record shared by every recipient
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubmissionCodec {

    static final String UNKNOWN_RECIPIENT = "unknown";
    private static final Set<String> LEGACY_STATUSES = Set.of("pending", "accepted", "rejected", "failed");

    private final ObjectMapper objectMapper;

    public String writeEnvelope(Envelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Envelope serialization failed", e);
        }
    }

    /**
     * @return null when the stored envelope is unreadable
     */
    public Envelope readEnvelope(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Envelope.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable envelope: {}", e.getOriginalMessage());
            return null;
        }
    }

    public List<String> envelopeRecipients(String envelopeJson) {
        Envelope envelope = readEnvelope(envelopeJson);
        return envelope == null ? List.of() : envelope.getRecipientEmails();
    }

    public String encode(Map<String, DeliveryStatus> statuses) {
        try {
            return objectMapper.writeValueAsString(statuses);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Delivery status serialization failed", e);
        }
    }

    /**
     * Decode a stored map; unreadable or empty values fall back to a pending entry per recipient
     */
    public Map<String, DeliveryStatus> decode(String json, List<String> fallbackRecipients) {
        if (json == null || json.isBlank()) {
            return initial(fallbackRecipients);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable delivery status, resetting: {}", e.getOriginalMessage());
            return initial(fallbackRecipients);
        }
        if (node == null || !node.isObject()) {
            return initial(fallbackRecipients);
        }
        if (node.isEmpty()) {
            return new LinkedHashMap<>();
        }
        if (isLegacyRecord(node)) {
            DeliveryStatus shared = fromLegacy(node);
            Map<String, DeliveryStatus> map = new LinkedHashMap<>();
            for (String recipient : recipientsOrUnknown(fallbackRecipients)) {
                map.put(recipient, copy(shared));
            }
            return map;
        }

        Map<String, DeliveryStatus> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isObject()) {
                return initial(fallbackRecipients);
            }
            if (isLegacyRecord(value)) {
                map.put(field.getKey(), fromLegacy(value));
            } else {
                try {
                    map.put(field.getKey(), objectMapper.treeToValue(value, DeliveryStatus.class));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    log.warn("Unreadable delivery status for {}, resetting", field.getKey());
                    return initial(fallbackRecipients);
                }
            }
        }
        return map;
    }

    /**
     * One queued entry per recipient, or a single "unknown" entry
     */
    public static Map<String, DeliveryStatus> initial(List<String> recipients) {
        Map<String, DeliveryStatus> map = new LinkedHashMap<>();
        for (String recipient : recipientsOrUnknown(recipients)) {
            map.put(recipient, pending());
        }
        return map;
    }

    /**
     * Set {@code status} for the given recipients, matching existing keys case-insensitively.
     * A null or empty recipient list targets every existing key.
     */
    public static Map<String, DeliveryStatus> apply(Map<String, DeliveryStatus> current,
                                                    List<String> recipients,
                                                    DeliveryStatus status) {
        Map<String, DeliveryStatus> next = current == null ? new LinkedHashMap<>() : new LinkedHashMap<>(current);
        Map<String, String> index = new HashMap<>();
        for (String key : next.keySet()) {
            index.put(key.toLowerCase(), key);
        }

        List<String> targets = new ArrayList<>();
        if (recipients != null && !recipients.isEmpty()) {
            for (String recipient : recipients) {
                String sanitized = sanitize(recipient);
                if (sanitized == null) {
                    continue;
                }
                String key = index.computeIfAbsent(sanitized.toLowerCase(), k -> sanitized);
                targets.add(key);
            }
        } else {
            targets.addAll(next.keySet());
            if (targets.isEmpty()) {
                targets.add(UNKNOWN_RECIPIENT);
            }
        }

        for (String key : targets) {
            next.put(key, copy(status));
        }
        return next;
    }

    static DeliveryStatus pending() {
        return DeliveryStatus.builder()
                .delivered(DeliveryStatus.Delivered.QUEUED)
                .displayed(DeliveryStatus.Displayed.UNKNOWN)
                .build();
    }

    private static boolean isLegacyRecord(JsonNode node) {
        return node.isObject()
                && node.path("status").isTextual()
                && LEGACY_STATUSES.contains(node.path("status").asText())
                && node.path("lastAttempt").isNumber()
                && node.path("retryCount").isNumber();
    }

    private static DeliveryStatus fromLegacy(JsonNode node) {
        switch (node.path("status").asText()) {
            case "accepted":
                return DeliveryStatus.of(250, "2.0.0", "Accepted by outbound transport", DeliveryStatus.Delivered.QUEUED);
            case "rejected":
                return DeliveryStatus.of(550, "5.7.1", "Rejected", DeliveryStatus.Delivered.NO);
            case "failed":
                return DeliveryStatus.of(550, "5.4.1", "Delivery failed after retries", DeliveryStatus.Delivered.NO);
            default:
                return pending();
        }
    }

    private static List<String> recipientsOrUnknown(List<String> recipients) {
        List<String> result = new ArrayList<>();
        if (recipients != null) {
            for (String recipient : recipients) {
                String sanitized = sanitize(recipient);
                if (sanitized != null && !result.contains(sanitized)) {
                    result.add(sanitized);
                }
            }
        }
        if (result.isEmpty()) {
            result.add(UNKNOWN_RECIPIENT);
        }
        return result;
    }

    private static String sanitize(String recipient) {
        if (recipient == null) {
            return null;
        }
        String trimmed = recipient.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static DeliveryStatus copy(DeliveryStatus status) {
        return status.toBuilder().build();
    }
}
