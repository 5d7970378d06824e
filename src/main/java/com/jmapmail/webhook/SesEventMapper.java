package com.jmapmail.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.jmapmail.domain.DeliveryNotification;
import com.jmapmail.domain.DeliveryStatus;
import com.jmapmail.domain.SubmissionStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps an SES event (the SNS Message payload) to a delivery notification
 */
public final class SesEventMapper {

    private static final Set<String> PERMANENT_DELAY_TYPES = Set.of("MailboxFull", "SpamDetected");

    private SesEventMapper() {}

    /**
     * @return null for event types that carry no delivery outcome (Send, Open, Click...)
     */
    public static DeliveryNotification map(JsonNode event) {
        String eventType = eventType(event);
        if (eventType == null) {
            return null;
        }
        DeliveryNotification.DeliveryNotificationBuilder builder = DeliveryNotification.builder()
                .submissionId(submissionId(event))
                .providerMessageId(textAt(event.path("mail"), "messageId"));

        switch (eventType) {
            case "DELIVERY":
                return builder
                        .status(SubmissionStatus.SENT)
                        .recipients(stringList(event.path("delivery").path("recipients")))
                        .deliveryStatus(DeliveryStatus.of(250, "2.0.0",
                                textOr(event.path("delivery"), "smtpResponse", "Delivered"),
                                DeliveryStatus.Delivered.YES))
                        .build();
            case "BOUNCE": {
                JsonNode bounced = event.path("bounce").path("bouncedRecipients");
                String diagnostic = bounced.isArray() && bounced.size() > 0
                        ? textAt(bounced.get(0), "diagnosticCode") : null;
                return builder
                        .status(SubmissionStatus.FAILED)
                        .recipients(addressList(bounced))
                        .deliveryStatus(DeliveryStatus.of(550, "5.1.1",
                                diagnostic != null ? diagnostic : "Bounce", DeliveryStatus.Delivered.NO))
                        .build();
            }
            case "REJECT":
                return builder
                        .status(SubmissionStatus.FAILED)
                        .deliveryStatus(DeliveryStatus.of(550, "5.7.1",
                                textOr(event.path("reject"), "reason", "Rejected"), DeliveryStatus.Delivered.NO))
                        .build();
            case "COMPLAINT":
                return builder
                        .status(SubmissionStatus.FAILED)
                        .recipients(addressList(event.path("complaint").path("complainedRecipients")))
                        .deliveryStatus(DeliveryStatus.of(550, "5.7.1",
                                textOr(event.path("complaint"), "complaintFeedbackType", "Complaint"),
                                DeliveryStatus.Delivered.NO))
                        .build();
            case "RENDERING FAILURE":
            case "RENDERINGFAILURE":
            case "FAILURE": {
                JsonNode failure = event.has("failure") ? event.path("failure") : event.path("renderingFailure");
                return builder
                        .status(SubmissionStatus.FAILED)
                        .deliveryStatus(DeliveryStatus.of(550, "5.6.0",
                                textOr(failure, "errorMessage", "Failure"), DeliveryStatus.Delivered.NO))
                        .build();
            }
            case "DELIVERYDELAY": {
                JsonNode delay = event.path("deliveryDelay");
                boolean permanent = isPermanentDelay(textAt(delay, "delayType"));
                String reason = textOr(delay, "delayType", "Delivery delayed");
                return builder
                        .status(permanent ? SubmissionStatus.FAILED : null)
                        .recipients(addressList(delay.path("delayedRecipients")))
                        .deliveryStatus(permanent
                                ? DeliveryStatus.of(550, "5.4.7", reason, DeliveryStatus.Delivered.NO)
                                : DeliveryStatus.of(451, "4.4.7", reason, DeliveryStatus.Delivered.QUEUED))
                        .build();
            }
            default:
                return null;
        }
    }

    /**
     * eventType (event publishing) or notificationType (identity notifications), upper-cased
     */
    static String eventType(JsonNode event) {
        String type = textAt(event, "eventType");
        if (type == null) {
            type = textAt(event, "notificationType");
        }
        return type == null ? null : type.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * First value of the submissionId message tag
     */
    static String submissionId(JsonNode event) {
        JsonNode tags = event.path("mail").path("tags");
        JsonNode values = tags.has("submissionId") ? tags.get("submissionId") : tags.get("SubmissionId");
        if (values == null || !values.isArray() || values.isEmpty()) {
            return null;
        }
        String candidate = values.get(0).asText("");
        return candidate.isEmpty() ? null : candidate;
    }

    // delays the recipient side will not resolve by itself
    static boolean isPermanentDelay(String delayType) {
        return delayType != null && PERMANENT_DELAY_TYPES.contains(delayType);
    }

    private static List<String> addressList(JsonNode recipients) {
        if (!recipients.isArray() || recipients.isEmpty()) {
            return null;
        }
        List<String> addresses = new ArrayList<>();
        for (JsonNode recipient : recipients) {
            String address = textAt(recipient, "emailAddress");
            if (address != null) {
                addresses.add(address);
            }
        }
        return addresses.isEmpty() ? null : addresses;
    }

    private static List<String> stringList(JsonNode values) {
        if (!values.isArray() || values.isEmpty()) {
            return null;
        }
        List<String> list = new ArrayList<>();
        values.forEach(value -> list.add(value.asText()));
        return list;
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        String value = textAt(node, field);
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String textAt(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
