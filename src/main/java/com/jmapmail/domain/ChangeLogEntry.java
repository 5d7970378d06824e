package com.jmapmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable change log row
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeLogEntry {

    private String id;
    private String accountId;
    private JmapType type;
    private String objectId;
    private ChangeOp op;
    private long modSeq;
    private String updatedProperties;   // comma separated, null when unknown
    private Instant createdAt;
}
