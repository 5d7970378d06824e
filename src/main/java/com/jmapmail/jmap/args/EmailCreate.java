package com.jmapmail.jmap.args;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.jmapmail.domain.EmailAddress;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Email/set create: either an uploaded blobId or structured draft fields
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailCreate {

    private String blobId;
    private Map<String, Boolean> mailboxIds;
    private Map<String, Boolean> keywords;
    private Instant receivedAt;

    private List<EmailAddress> from;
    private List<EmailAddress> to;
    private List<EmailAddress> cc;
    private List<EmailAddress> bcc;
    private List<EmailAddress> replyTo;
    private String subject;
    private String textBody;
    private String htmlBody;
    private List<String> inReplyTo;
    private List<String> references;
    private List<AttachmentRef> attachments;

    @JsonIgnore
    public boolean isDraftFields() {
        return textBody != null || htmlBody != null || subject != null
                || from != null || to != null || cc != null || bcc != null || replyTo != null
                || attachments != null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AttachmentRef {
        private String blobId;
        private String type;
        private String name;
        private String disposition;
        private String cid;
    }
}
