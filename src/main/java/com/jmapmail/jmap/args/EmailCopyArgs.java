package com.jmapmail.jmap.args;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Email/copy arguments; only same-account copies are supported
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class EmailCopyArgs extends MethodArgs {

    private String fromAccountId;
    private String ifFromInState;
    private String ifInState;
    private Map<String, CopyEntry> create;
    private boolean onSuccessDestroyOriginal;
    private String destroyFromIfInState;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CopyEntry {
        private String id;
        private Map<String, Boolean> mailboxIds;
        private Map<String, Boolean> keywords;
        private Instant receivedAt;
    }
}
