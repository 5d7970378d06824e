package com.jmapmail.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * JMAP mail server configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "jmapmail")
public class ServerProperties {

    private String domain = "localhost";
    private String baseUrl = "http://localhost:8080";

    private Storage storage = new Storage();
    private Limits limits = new Limits();
    private Queue queue = new Queue();
    private Outbound outbound = new Outbound();
    private Webhook webhook = new Webhook();
    private Maintenance maintenance = new Maintenance();
    private Security security = new Security();

    /**
     * Host name announced in SMTP HELO and generated Message-IDs
     */
    public String getAdvertisedHostname() {
        String configured = outbound.getHeloName() == null ? "" : outbound.getHeloName().trim();
        if (!configured.isEmpty()) {
            return configured;
        }
        String configuredDomain = domain == null ? "" : domain.trim().toLowerCase();
        if (configuredDomain.isEmpty() || "localhost".equals(configuredDomain)) {
            return "localhost";
        }
        return "mail." + configuredDomain;
    }

    @Data
    public static class Storage {
        /**
         * Content-addressed blobs are stored under blobPath/ab/cd/abcd...
         */
        private String blobPath = "data/blobs";
    }

    @Data
    public static class Limits {
        private long maxSizeUpload = 18874368L; // 18MB
        private int maxCallsInRequest = 16;
        private int maxObjectsInGet = 500;
        private int maxObjectsInSet = 128;
        private int maxMailboxesPerEmail = 32;
        private long maxSizeAttachmentsPerEmail = 18874368L;
        private int maxSizeMailboxName = 255;
        private int maxChanges = 256;
        private int maxStoredBodyBytes = 262144; // 256KB
    }

    @Data
    public static class Queue {
        private List<Long> backoffSeconds = new ArrayList<>(List.of(60L, 300L, 900L, 3600L, 21600L));
        private int sweepBatchSize = 10;
        private long sweepIntervalMs = 30000L;
        private long sendTimeoutMs = 120000L;
        private String submissionDestination = "jmap.submission.queue";
        private String inboundDestination = "mail.inbound.queue";
        /**
         * Listener consumers per queue; SQLite has a single writer, so keep this small
         */
        private String listenerConcurrency = "1-3";
    }

    @Data
    public static class Outbound {
        /**
         * Smart host; when empty, mail goes directly to the recipient domain's MX hosts
         */
        private String relayHost = "";
        private int relayPort = 587;
        private String username = "";
        private String password = "";
        private boolean starttls = true;
        private String heloName = "";
        private long connectTimeoutMs = 10000L;
        private long readTimeoutMs = 30000L;

        public boolean hasRelay() {
            return relayHost != null && !relayHost.isBlank();
        }

        public boolean hasCredentials() {
            return username != null && !username.isBlank();
        }
    }

    @Data
    public static class Webhook {
        private String token = "";
        private String topicArn = "";
        private boolean verifySignature = true;
        private String certificateHostSuffix = ".amazonaws.com";
    }

    @Data
    public static class Maintenance {
        private long intervalMs = 3600000L;
        private long orphanBlobGraceMinutes = 1440L;
    }

    @Data
    public static class Security {
        /**
         * Header set by the authenticating reverse proxy
         */
        private String accountHeader = "X-Account-Id";
    }
}
