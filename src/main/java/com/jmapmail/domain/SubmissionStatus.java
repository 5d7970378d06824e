package com.jmapmail.domain;

/**
 * Queue status of an EmailSubmission
 * PENDING -> SENDING -> SENT | FAILED | PENDING (retry); CANCELED only from PENDING
 */
public enum SubmissionStatus {
    PENDING,
    SENDING,
    SENT,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this == SENT || this == FAILED || this == CANCELED;
    }
}
