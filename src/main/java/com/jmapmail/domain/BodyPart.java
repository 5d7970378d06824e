package com.jmapmail.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Node of the stored MIME body structure (JMAP EmailBodyPart shape)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BodyPart {

    private String partId;      // null for multipart containers
    private String blobId;      // null for inlined text bodies
    private long size;
    private String type;
    private String charset;
    private String disposition;
    private String name;
    private String cid;
    private List<BodyPart> subParts;
}
