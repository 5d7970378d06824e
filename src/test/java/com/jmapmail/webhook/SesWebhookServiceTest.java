package com.jmapmail.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.DeliveryNotification;
import com.jmapmail.domain.SubmissionStatus;
import com.jmapmail.service.SubmissionStateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SesWebhookService unit tests
 */
@ExtendWith(MockitoExtension.class)
class SesWebhookServiceTest {

    private static final String TOPIC = "arn:aws:sns:us-east-1:123456789012:ses-events";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private SnsSignatureVerifier signatureVerifier;

    @Mock
    private SigningCertificateCache certificateCache;

    @Mock
    private SubmissionStateService stateService;

    @Mock
    private RestClient restClient;

    private ServerProperties properties;
    private SesWebhookService webhookService;

    @BeforeEach
    void setUp() {
        properties = new ServerProperties();
        properties.getWebhook().setTopicArn(TOPIC);
        webhookService = new SesWebhookService(signatureVerifier, certificateCache, stateService, restClient,
                objectMapper, properties);
    }

    private ObjectNode envelope(String topic, String message) {
        ObjectNode sns = objectMapper.createObjectNode();
        sns.put("Type", "Notification");
        sns.put("MessageId", "m-1");
        sns.put("TopicArn", topic);
        sns.put("Message", message);
        return sns;
    }

    private static final String DELIVERY = "{\"eventType\":\"Delivery\","
            + "\"mail\":{\"messageId\":\"prov-1\",\"tags\":{\"submissionId\":[\"S1\"]}}}";

    @Test
    @DisplayName("Bare envelope, array of records and {Records: [...]} are all accepted")
    void testEnvelopeShapes() {
        ObjectNode sns = envelope(TOPIC, DELIVERY);
        ObjectNode record = objectMapper.createObjectNode();
        record.set("Sns", sns);

        assertThat(SesWebhookService.envelopes(sns)).hasSize(1);
        assertThat(SesWebhookService.envelopes(objectMapper.createArrayNode().add(record).add(record))).hasSize(2);
        ObjectNode wrapped = objectMapper.createObjectNode();
        wrapped.putArray("Records").add(record);
        assertThat(SesWebhookService.envelopes(wrapped)).hasSize(1);
        assertThat(SesWebhookService.envelopes(objectMapper.createObjectNode())).isEmpty();
    }

    @Test
    @DisplayName("Verified notification on the configured topic is applied")
    void testAppliesNotification() {
        JsonNode sns = envelope(TOPIC, DELIVERY);
        when(signatureVerifier.verify(sns)).thenReturn(true);
        when(stateService.applyNotification(any(DeliveryNotification.class))).thenReturn(true);

        assertThat(webhookService.process(sns)).isEqualTo(1);

        ArgumentCaptor<DeliveryNotification> captor = ArgumentCaptor.forClass(DeliveryNotification.class);
        verify(stateService).applyNotification(captor.capture());
        assertThat(captor.getValue().getSubmissionId()).isEqualTo("S1");
        assertThat(captor.getValue().getStatus()).isEqualTo(SubmissionStatus.SENT);
    }

    @Test
    @DisplayName("Bad signature or foreign topic is dropped")
    void testDropped() {
        JsonNode unsigned = envelope(TOPIC, DELIVERY);
        when(signatureVerifier.verify(unsigned)).thenReturn(false);
        JsonNode foreign = envelope("arn:aws:sns:us-east-1:999:other", DELIVERY);
        when(signatureVerifier.verify(foreign)).thenReturn(true);

        assertThat(webhookService.process(unsigned)).isZero();
        assertThat(webhookService.process(foreign)).isZero();
        verify(stateService, never()).applyNotification(any());
    }

    @Test
    @DisplayName("Signature checks can be switched off")
    void testVerificationDisabled() {
        properties.getWebhook().setVerifySignature(false);
        when(stateService.applyNotification(any(DeliveryNotification.class))).thenReturn(true);

        assertThat(webhookService.process(envelope(TOPIC, DELIVERY))).isEqualTo(1);
        verify(signatureVerifier, never()).verify(any());
    }

    @Test
    @DisplayName("Subscription confirmation with an untrusted SubscribeURL is not fetched")
    void testUntrustedSubscription() {
        ObjectNode sns = envelope(TOPIC, "confirm");
        sns.put("Type", "SubscriptionConfirmation");
        sns.put("SubscribeURL", "https://attacker.example.com/confirm");
        when(signatureVerifier.verify(sns)).thenReturn(true);
        when(certificateCache.isTrustedUrl("https://attacker.example.com/confirm")).thenReturn(false);

        assertThat(webhookService.process(sns)).isZero();
        verify(restClient, never()).get();
    }

    @Test
    @DisplayName("Subscription confirmation for a foreign topic is never fetched, even from a trusted host")
    void testForeignTopicSubscription() {
        ObjectNode sns = envelope("arn:aws:sns:us-east-1:999:other", "confirm");
        sns.put("Type", "SubscriptionConfirmation");
        sns.put("SubscribeURL", "https://sns.us-east-1.amazonaws.com/?Action=ConfirmSubscription&Token=t");
        when(signatureVerifier.verify(sns)).thenReturn(true);

        assertThat(webhookService.process(sns)).isZero();
        verify(certificateCache, never()).isTrustedUrl(any());
        verify(restClient, never()).get();
    }

    @Test
    @DisplayName("Unparseable message body is ignored")
    void testUnparseableMessage() {
        JsonNode sns = envelope(TOPIC, "not json");
        when(signatureVerifier.verify(sns)).thenReturn(true);

        assertThat(webhookService.process(sns)).isZero();
        verify(stateService, never()).applyNotification(any());
    }

    @Test
    @DisplayName("Records list parses only entries carrying a Sns message")
    void testRecordsWithoutMessage() {
        ObjectNode record = objectMapper.createObjectNode();
        record.putObject("Sns").put("Type", "Notification");
        assertThat(SesWebhookService.envelopes(objectMapper.createArrayNode().add(record))).isEqualTo(List.of());
    }
}
