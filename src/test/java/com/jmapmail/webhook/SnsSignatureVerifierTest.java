package com.jmapmail.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SnsSignatureVerifier unit tests
 */
@ExtendWith(MockitoExtension.class)
class SnsSignatureVerifierTest {

    private static final String CERT_URL = "https://sns.us-east-1.amazonaws.com/SimpleNotificationService-abc.pem";

    private static KeyPair keyPair;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private SigningCertificateCache certificateCache;

    private SnsSignatureVerifier verifier;

    @BeforeAll
    static void generateKeys() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        keyPair = generator.generateKeyPair();
    }

    @BeforeEach
    void setUp() {
        verifier = new SnsSignatureVerifier(certificateCache);
    }

    private ObjectNode notification() {
        ObjectNode sns = objectMapper.createObjectNode();
        sns.put("Type", "Notification");
        sns.put("MessageId", "msg-1");
        sns.put("TopicArn", "arn:aws:sns:us-east-1:123456789012:ses-events");
        sns.put("Message", "{\"eventType\":\"Delivery\"}");
        sns.put("Timestamp", "2024-05-01T12:00:00.000Z");
        sns.put("SigningCertURL", CERT_URL);
        return sns;
    }

    private void sign(ObjectNode sns, String version, String algorithm) throws Exception {
        Signature signer = Signature.getInstance(algorithm);
        signer.initSign(keyPair.getPrivate());
        signer.update(SnsSignatureVerifier.canonicalString(sns).getBytes(StandardCharsets.UTF_8));
        sns.put("SignatureVersion", version);
        sns.put("Signature", Base64.getEncoder().encodeToString(signer.sign()));
    }

    @Test
    @DisplayName("Canonical string lists Key\\nValue\\n pairs in order and skips a missing Subject")
    void testCanonicalString() {
        String canonical = SnsSignatureVerifier.canonicalString(notification());

        assertThat(canonical).isEqualTo("Message\n{\"eventType\":\"Delivery\"}\n"
                + "MessageId\nmsg-1\n"
                + "Timestamp\n2024-05-01T12:00:00.000Z\n"
                + "TopicArn\narn:aws:sns:us-east-1:123456789012:ses-events\n"
                + "Type\nNotification\n");
    }

    @Test
    @DisplayName("Subscription confirmations also sign SubscribeURL and Token")
    void testSubscriptionCanonicalString() {
        ObjectNode sns = notification();
        sns.put("Type", "SubscriptionConfirmation");
        assertThat(SnsSignatureVerifier.canonicalString(sns)).isNull();

        sns.put("SubscribeURL", "https://sns.us-east-1.amazonaws.com/?Action=ConfirmSubscription");
        sns.put("Token", "tok");
        assertThat(SnsSignatureVerifier.canonicalString(sns)).contains("SubscribeURL\n").contains("Token\ntok\n");
    }

    @Test
    @DisplayName("SignatureVersion 2 (SHA256withRSA) verifies")
    void testVersion2() throws Exception {
        ObjectNode sns = notification();
        sign(sns, "2", "SHA256withRSA");
        when(certificateCache.getPublicKey(CERT_URL)).thenReturn(keyPair.getPublic());

        assertThat(verifier.verify(sns)).isTrue();
    }

    @Test
    @DisplayName("SignatureVersion 1 (SHA1withRSA) verifies")
    void testVersion1() throws Exception {
        ObjectNode sns = notification();
        sns.put("Subject", "Amazon SES Email Event Notification");
        sign(sns, "1", "SHA1withRSA");
        when(certificateCache.getPublicKey(CERT_URL)).thenReturn(keyPair.getPublic());

        assertThat(verifier.verify(sns)).isTrue();
    }

    @Test
    @DisplayName("Tampered message fails verification")
    void testTampered() throws Exception {
        ObjectNode sns = notification();
        sign(sns, "2", "SHA256withRSA");
        sns.put("Message", "{\"eventType\":\"Bounce\"}");
        when(certificateCache.getPublicKey(CERT_URL)).thenReturn(keyPair.getPublic());

        assertThat(verifier.verify(sns)).isFalse();
    }

    @Test
    @DisplayName("Unknown SignatureVersion is rejected before fetching a certificate")
    void testUnknownVersion() throws Exception {
        ObjectNode sns = notification();
        sign(sns, "3", "SHA256withRSA");

        assertThat(verifier.verify(sns)).isFalse();
        verify(certificateCache, never()).getPublicKey(anyString());
    }

    @Test
    @DisplayName("Untrusted certificate URL fails verification")
    void testNoKey() throws Exception {
        ObjectNode sns = notification();
        sign(sns, "2", "SHA256withRSA");
        when(certificateCache.getPublicKey(CERT_URL)).thenReturn(null);

        assertThat(verifier.verify(sns)).isFalse();
    }
}
