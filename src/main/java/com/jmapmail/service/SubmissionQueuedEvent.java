package com.jmapmail.service;

import lombok.Value;

/**
 * Published when a submission row is inserted; dispatched to the JMS queue after commit
 */
@Value
public class SubmissionQueuedEvent {

    String submissionId;
}
