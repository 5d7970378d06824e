package com.jmapmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Content-addressed blob metadata (sha256 hex is the JMAP blobId)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Blob {

    private String sha256;
    private long size;
    private String storageKey;  // path relative to the blob store root
    private Instant createdAt;
}
