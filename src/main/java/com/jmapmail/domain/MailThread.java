package com.jmapmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Conversation thread of one account
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MailThread {

    private String id;
    private String accountId;
    private String subject;
    private Instant latestMessageAt;
    private Instant createdAt;
    private Instant updatedAt;
}
