package com.jmapmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-account view of a canonical message (a JMAP Email)
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AccountMessage {

    private String id;
    private String accountId;
    private String messageId;   // canonical message id
    private String threadId;
    private Instant internalDate;
    private boolean seen;
    private boolean flagged;
    private boolean answered;
    private boolean draft;
    private boolean deleted;
    private Instant createdAt;
    private Instant updatedAt;
}
