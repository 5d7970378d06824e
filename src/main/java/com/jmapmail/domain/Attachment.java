package com.jmapmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Blob-backed MIME part of a canonical message
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Attachment {

    private String id;
    private String messageId;
    private String partId;
    private String blobSha256;
    private String filename;
    private String mimeType;
    private String disposition;
    private String contentId;
    private long size;
    private int position;
}
