package com.jmapmail.jmap;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.Account;
import com.jmapmail.service.ChangeLogService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JMAP session resource (GET /.well-known/jmap)
 */
@Component
@RequiredArgsConstructor
public class SessionDocumentBuilder {

    private final ServerProperties properties;
    private final ChangeLogService changeLogService;

    public Map<String, Object> build(Account account) {
        ServerProperties.Limits limits = properties.getLimits();
        String baseUrl = trimSlash(properties.getBaseUrl());

        Map<String, Object> core = new LinkedHashMap<>();
        core.put("maxSizeUpload", limits.getMaxSizeUpload());
        core.put("maxConcurrentUpload", 4);
        core.put("maxSizeRequest", 10_000_000);
        core.put("maxConcurrentRequests", 4);
        core.put("maxCallsInRequest", limits.getMaxCallsInRequest());
        core.put("maxObjectsInGet", limits.getMaxObjectsInGet());
        core.put("maxObjectsInSet", limits.getMaxObjectsInSet());
        core.put("collationAlgorithms", List.of());

        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put(JmapCapabilities.CORE, core);
        capabilities.put(JmapCapabilities.MAIL, Map.of());
        capabilities.put(JmapCapabilities.SUBMISSION, Map.of());

        Map<String, Object> mail = new LinkedHashMap<>();
        mail.put("maxMailboxesPerEmail", limits.getMaxMailboxesPerEmail());
        mail.put("maxMailboxDepth", null);
        mail.put("maxSizeMailboxName", limits.getMaxSizeMailboxName());
        mail.put("maxSizeAttachmentsPerEmail", limits.getMaxSizeAttachmentsPerEmail());
        mail.put("emailQuerySortOptions", List.of("receivedAt"));
        mail.put("mayCreateTopLevelMailbox", true);

        Map<String, Object> submission = new LinkedHashMap<>();
        submission.put("maxDelayedSend", 0);
        submission.put("submissionExtensions", Map.of());

        Map<String, Object> accountCapabilities = new LinkedHashMap<>();
        accountCapabilities.put(JmapCapabilities.MAIL, mail);
        accountCapabilities.put(JmapCapabilities.SUBMISSION, submission);

        Map<String, Object> accountEntry = new LinkedHashMap<>();
        accountEntry.put("name", account.getAddress());
        accountEntry.put("isPersonal", true);
        accountEntry.put("isReadOnly", false);
        accountEntry.put("accountCapabilities", accountCapabilities);

        Map<String, Object> session = new LinkedHashMap<>();
        session.put("capabilities", capabilities);
        session.put("accounts", Map.of(account.getId(), accountEntry));
        session.put("primaryAccounts", Map.of(
                JmapCapabilities.MAIL, account.getId(),
                JmapCapabilities.SUBMISSION, account.getId()));
        session.put("username", account.getAddress());
        session.put("apiUrl", baseUrl + "/jmap");
        session.put("downloadUrl", baseUrl + "/blobs/download/{accountId}/{blobId}/{name}?type={type}");
        session.put("uploadUrl", baseUrl + "/blobs/upload/{accountId}/{type}");
        session.put("eventSourceUrl", null);
        session.put("state", changeLogService.getSessionState(account.getId()));
        return session;
    }

    private static String trimSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
