package com.jmapmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Provider report about a sent submission, located by submission id or provider message id
 * - status: new queue status, null to keep the current one (non-final delays)
 * - recipients: affected recipients, null for all
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryNotification {

    private String submissionId;
    private String providerMessageId;
    private SubmissionStatus status;
    private List<String> recipients;
    private DeliveryStatus deliveryStatus;
}
