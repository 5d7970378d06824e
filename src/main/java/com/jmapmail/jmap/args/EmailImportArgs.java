package com.jmapmail.jmap.args;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Email/import arguments; each entry names an uploaded RFC 5322 blob
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class EmailImportArgs extends MethodArgs {

    private String ifInState;
    private Map<String, ImportEntry> emails;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImportEntry {
        private String blobId;
        private Map<String, Boolean> mailboxIds;
        private Map<String, Boolean> keywords;
        private Instant receivedAt;
    }
}
