package com.jmapmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Queued outbound delivery request
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EmailSubmission {

    private String id;
    private String accountId;
    private String emailId;
    private String identityId;
    private String threadId;
    private String envelopeJson;
    private Instant sendAt;
    private String deliveryStatusJson;
    private String undoStatus;      // pending, final, canceled
    private SubmissionStatus status;
    private Instant nextAttemptAt;
    private int retryCount;
    private Instant lastAttemptAt;
    private String providerMessageId;
    private Instant createdAt;
    private Instant updatedAt;
}
