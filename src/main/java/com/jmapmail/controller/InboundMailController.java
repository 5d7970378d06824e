package com.jmapmail.controller;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.queue.MailQueueProducer;
import com.jmapmail.util.CryptoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jms.JmsException;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inbound mail hand-off (POST /inbound?rcpt=a@x&rcpt=b@x)
 * - Body is the raw RFC 5322 message
 * - The message is queued; delivery to local accounts happens in the queue consumer
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class InboundMailController {

    private final MailQueueProducer producer;
    private final ServerProperties properties;

    @PostMapping("/inbound")
    public ResponseEntity<Map<String, Object>> receive(
            @RequestHeader(value = SesWebhookController.TOKEN_HEADER, required = false) String token,
            @RequestParam("rcpt") List<String> recipients,
            @RequestBody(required = false) byte[] body) {
        String expected = properties.getWebhook().getToken();
        if (expected != null && !expected.isBlank() && !CryptoUtil.secureEquals(expected, token)) {
            return errorResponse(HttpStatus.UNAUTHORIZED, "Unauthorized");
        }
        if (body == null || body.length == 0) {
            return errorResponse(HttpStatus.BAD_REQUEST, "Empty message");
        }
        if (recipients.isEmpty()) {
            return errorResponse(HttpStatus.BAD_REQUEST, "rcpt is required.");
        }

        try {
            producer.enqueueInbound(body, recipients);
        } catch (JmsException e) {
            log.error("Failed to queue inbound message for {}", recipients, e);
            return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Queue unavailable");
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "queued");
        response.put("size", body.length);
        response.put("recipients", recipients);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
