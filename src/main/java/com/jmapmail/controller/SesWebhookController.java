package com.jmapmail.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jmapmail.config.ServerProperties;
import com.jmapmail.util.CryptoUtil;
import com.jmapmail.webhook.SesWebhookService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SES delivery events (POST /ses/events)
 * - Requires X-Webhook-Token to match the configured token
 * - Body is the SNS payload as delivered; see SesWebhookService for accepted shapes
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SesWebhookController {

    static final String TOKEN_HEADER = "X-Webhook-Token";

    private final SesWebhookService webhookService;
    private final ObjectMapper objectMapper;
    private final ServerProperties properties;

    @PostMapping("/ses/events")
    public ResponseEntity<Map<String, Object>> events(
            @RequestHeader(value = TOKEN_HEADER, required = false) String token,
            @RequestBody(required = false) String body) {
        String expected = properties.getWebhook().getToken();
        if (expected == null || expected.isBlank()) {
            log.error("SES webhook called but no webhook token is configured");
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Webhook token not configured");
        }
        if (!CryptoUtil.secureEquals(expected, token)) {
            log.warn("SES webhook rejected: bad token");
            return errorResponse(HttpStatus.UNAUTHORIZED, "Unauthorized");
        }

        JsonNode payload;
        try {
            payload = body == null ? null : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return errorResponse(HttpStatus.BAD_REQUEST, "Invalid JSON");
        }
        if (payload == null) {
            return errorResponse(HttpStatus.BAD_REQUEST, "Invalid JSON");
        }

        int processed = webhookService.process(payload);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("processed", processed);
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
