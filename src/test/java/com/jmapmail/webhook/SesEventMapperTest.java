package com.jmapmail.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jmapmail.domain.DeliveryNotification;
import com.jmapmail.domain.DeliveryStatus;
import com.jmapmail.domain.SubmissionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SesEventMapper unit tests
 */
class SesEventMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode event(String json) throws Exception {
        return objectMapper.readTree(json);
    }

    @Test
    @DisplayName("Delivery: SENT, 250 2.0.0, delivered yes, located by submissionId tag")
    void testDelivery() throws Exception {
        DeliveryNotification notification = SesEventMapper.map(event("{"
                + "\"eventType\":\"Delivery\","
                + "\"mail\":{\"messageId\":\"prov-1\",\"tags\":{\"submissionId\":[\"S1\"]}},"
                + "\"delivery\":{\"recipients\":[\"you@remote.org\"],\"smtpResponse\":\"250 ok\"}}"));

        assertThat(notification.getSubmissionId()).isEqualTo("S1");
        assertThat(notification.getProviderMessageId()).isEqualTo("prov-1");
        assertThat(notification.getStatus()).isEqualTo(SubmissionStatus.SENT);
        assertThat(notification.getRecipients()).containsExactly("you@remote.org");
        assertThat(notification.getDeliveryStatus().getCode()).isEqualTo(250);
        assertThat(notification.getDeliveryStatus().getDelivered()).isEqualTo(DeliveryStatus.Delivered.YES);
    }

    @Test
    @DisplayName("Bounce: FAILED, 550 5.1.1 with the diagnostic code")
    void testBounce() throws Exception {
        DeliveryNotification notification = SesEventMapper.map(event("{"
                + "\"notificationType\":\"Bounce\","
                + "\"mail\":{\"messageId\":\"prov-1\"},"
                + "\"bounce\":{\"bouncedRecipients\":[{\"emailAddress\":\"you@remote.org\","
                + "\"diagnosticCode\":\"smtp; 550 user unknown\"}]}}"));

        assertThat(notification.getSubmissionId()).isNull();
        assertThat(notification.getStatus()).isEqualTo(SubmissionStatus.FAILED);
        assertThat(notification.getDeliveryStatus().getEnhancedStatus()).isEqualTo("5.1.1");
        assertThat(notification.getDeliveryStatus().getReason()).isEqualTo("smtp; 550 user unknown");
        assertThat(notification.getDeliveryStatus().getDelivered()).isEqualTo(DeliveryStatus.Delivered.NO);
    }

    @Test
    @DisplayName("Complaint and Reject fail with 5.7.1; Rendering Failure with 5.6.0")
    void testFailures() throws Exception {
        assertThat(SesEventMapper.map(event("{\"eventType\":\"Complaint\",\"mail\":{}}"))
                .getDeliveryStatus().getEnhancedStatus()).isEqualTo("5.7.1");
        assertThat(SesEventMapper.map(event("{\"eventType\":\"Reject\",\"mail\":{}}"))
                .getDeliveryStatus().getEnhancedStatus()).isEqualTo("5.7.1");
        DeliveryNotification rendering = SesEventMapper.map(event(
                "{\"eventType\":\"Rendering Failure\",\"mail\":{},\"failure\":{\"errorMessage\":\"bad template\"}}"));
        assertThat(rendering.getStatus()).isEqualTo(SubmissionStatus.FAILED);
        assertThat(rendering.getDeliveryStatus().getSmtpReply()).isEqualTo("550 5.6.0 bad template");
    }

    @Test
    @DisplayName("Transient DeliveryDelay keeps the status and reports 451 4.4.7")
    void testTransientDelay() throws Exception {
        DeliveryNotification notification = SesEventMapper.map(event("{"
                + "\"eventType\":\"DeliveryDelay\",\"mail\":{\"messageId\":\"prov-1\"},"
                + "\"deliveryDelay\":{\"delayType\":\"TransientCommunicationFailure\","
                + "\"delayedRecipients\":[{\"emailAddress\":\"you@remote.org\"}]}}"));

        assertThat(notification.getStatus()).isNull();
        assertThat(notification.getDeliveryStatus().getCode()).isEqualTo(451);
        assertThat(notification.getDeliveryStatus().getDelivered()).isEqualTo(DeliveryStatus.Delivered.QUEUED);
    }

    @Test
    @DisplayName("MailboxFull DeliveryDelay is a permanent failure with 5.4.7")
    void testPermanentDelay() throws Exception {
        DeliveryNotification notification = SesEventMapper.map(event(
                "{\"eventType\":\"DeliveryDelay\",\"mail\":{},\"deliveryDelay\":{\"delayType\":\"MailboxFull\"}}"));

        assertThat(notification.getStatus()).isEqualTo(SubmissionStatus.FAILED);
        assertThat(notification.getDeliveryStatus().getEnhancedStatus()).isEqualTo("5.4.7");
        assertThat(SesEventMapper.isPermanentDelay(null)).isFalse();
    }

    @Test
    @DisplayName("Events without a delivery outcome are ignored")
    void testIgnored() throws Exception {
        assertThat(SesEventMapper.map(event("{\"eventType\":\"Open\",\"mail\":{}}"))).isNull();
        assertThat(SesEventMapper.map(event("{\"mail\":{}}"))).isNull();
    }
}
