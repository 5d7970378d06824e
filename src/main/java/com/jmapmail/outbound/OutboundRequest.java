package com.jmapmail.outbound;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One outbound send; the raw MIME is referenced by blob hash, not carried inline
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundRequest {

    private String accountId;
    private String submissionId;
    private String emailId;
    private String mailFrom;
    private List<String> rcptTo;
    private String rawBlobSha256;
    private long size;
}
