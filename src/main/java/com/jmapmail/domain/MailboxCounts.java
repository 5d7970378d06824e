package com.jmapmail.domain;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregated message counters of one mailbox
 */
@Data
@NoArgsConstructor
public class MailboxCounts {

    private String mailboxId;
    private int totalEmails;
    private int unreadEmails;
    private int totalThreads;
    private int unreadThreads;
}
