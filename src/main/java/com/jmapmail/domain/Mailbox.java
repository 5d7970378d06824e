package com.jmapmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Mailbox entity
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Mailbox {

    private String id;
    private String accountId;
    private String name;
    private String parentId;    // null for top-level
    private String role;        // inbox, drafts, sent, archive, trash, spam or null
    private int sortOrder;
    private boolean subscribed;
    private Instant createdAt;
    private Instant updatedAt;
}
