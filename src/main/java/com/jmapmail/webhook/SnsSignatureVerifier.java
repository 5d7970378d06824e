package com.jmapmail.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Signature;
import java.util.Base64;
import java.util.List;

/**
 * Verifies the signature of an SNS message envelope
 * - SignatureVersion 1 is SHA1withRSA, 2 is SHA256withRSA
 * - The signed string is "Key\nValue\n" over a fixed, type-dependent field list
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnsSignatureVerifier {

    private static final List<String> NOTIFICATION_FIELDS =
            List.of("Message", "MessageId", "Subject", "Timestamp", "TopicArn", "Type");
    private static final List<String> SUBSCRIPTION_FIELDS =
            List.of("Message", "MessageId", "SubscribeURL", "Timestamp", "Token", "TopicArn", "Type");

    private final SigningCertificateCache certificateCache;

    public boolean verify(JsonNode sns) {
        String signature = text(sns, "Signature");
        String version = text(sns, "SignatureVersion");
        String certUrl = text(sns, "SigningCertURL") != null ? text(sns, "SigningCertURL") : text(sns, "SigningCertUrl");
        String algorithm = algorithm(version);
        if (signature == null || certUrl == null || algorithm == null) {
            return false;
        }
        String canonical = canonicalString(sns);
        if (canonical == null) {
            return false;
        }
        PublicKey key = certificateCache.getPublicKey(certUrl);
        if (key == null) {
            return false;
        }
        try {
            Signature verifier = Signature.getInstance(algorithm);
            verifier.initVerify(key);
            verifier.update(canonical.getBytes(StandardCharsets.UTF_8));
            return verifier.verify(Base64.getMimeDecoder().decode(signature));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.warn("SNS signature check error: {}", e.getMessage());
            return false;
        }
    }

    /**
     * String-to-sign for the envelope's Type; null when a required field is missing
     */
    static String canonicalString(JsonNode sns) {
        String type = text(sns, "Type");
        List<String> fields;
        if ("Notification".equals(type)) {
            fields = NOTIFICATION_FIELDS;
        } else if ("SubscriptionConfirmation".equals(type) || "UnsubscribeConfirmation".equals(type)) {
            fields = SUBSCRIPTION_FIELDS;
        } else {
            return null;
        }
        StringBuilder builder = new StringBuilder();
        for (String field : fields) {
            String value = text(sns, field);
            if (value == null) {
                // Subject is the only optional field
                if ("Subject".equals(field)) {
                    continue;
                }
                return null;
            }
            builder.append(field).append('\n').append(value).append('\n');
        }
        return builder.toString();
    }

    static String algorithm(String version) {
        if ("1".equals(version)) {
            return "SHA1withRSA";
        }
        if ("2".equals(version)) {
            return "SHA256withRSA";
        }
        return null;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
