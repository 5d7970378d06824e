package com.jmapmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Account-independent stored message, deduplicated by ingestId
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalMessage {

    private String id;
    private String ingestId;        // sha256 of the raw bytes
    private String rawBlobSha256;
    private String messageId;       // Message-ID without angle brackets
    private String inReplyTo;
    private String referencesJson;
    private String subject;
    private String snippet;
    private Instant sentAt;
    private long size;
    private boolean hasAttachment;
    private String bodyStructureJson;
    private String textBody;
    private boolean textBodyTruncated;
    private String htmlBody;
    private boolean htmlBodyTruncated;
    private Instant createdAt;
}
