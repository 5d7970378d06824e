package com.jmapmail.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.AccountMessage;
import com.jmapmail.domain.BodyPart;
import com.jmapmail.domain.CanonicalMessage;
import com.jmapmail.domain.EmailAddress;
import com.jmapmail.domain.EmailKeyword;
import com.jmapmail.domain.EmailQueryFilter;
import com.jmapmail.domain.JmapType;
import com.jmapmail.domain.MailThread;
import com.jmapmail.domain.MailboxMembership;
import com.jmapmail.domain.MessageAddress;
import com.jmapmail.jmap.GetResponse;
import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.jmap.QueryResponse;
import com.jmapmail.jmap.args.EmailGetArgs;
import com.jmapmail.jmap.args.EmailQueryArgs;
import com.jmapmail.jmap.args.GetArgs;
import com.jmapmail.mapper.AccountMessageMapper;
import com.jmapmail.mapper.CanonicalMessageMapper;
import com.jmapmail.mapper.ThreadMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read side of the mail model: Email/get, Email/query, Thread/get
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailQueryService {

    static final List<String> DEFAULT_EMAIL_PROPERTIES = List.of(
            "id", "blobId", "threadId", "mailboxIds", "keywords", "size", "receivedAt",
            "messageId", "inReplyTo", "references", "sender", "from", "to", "cc", "bcc", "replyTo",
            "subject", "sentAt", "hasAttachment", "preview", "bodyValues", "textBody", "htmlBody", "attachments");

    private static final List<String> ADDRESS_KINDS = List.of("from", "sender", "to", "cc", "bcc", "replyTo");

    private final AccountMessageMapper accountMessageMapper;
    private final CanonicalMessageMapper canonicalMessageMapper;
    private final ThreadMapper threadMapper;
    private final ChangeLogService changeLogService;
    private final ServerProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Email/get
     */
    public GetResponse getEmails(String accountId, EmailGetArgs args) {
        if (args.getIds() == null) {
            throw JmapException.invalidArguments("ids is required for Email/get");
        }
        checkGetLimit(args.getIds().size());
        String state = changeLogService.getState(accountId, JmapType.EMAIL);

        List<String> ids = new ArrayList<>(new LinkedHashSet<>(args.getIds()));
        Map<String, AccountMessage> messages = new HashMap<>();
        Map<String, CanonicalMessage> canonical = new HashMap<>();
        Map<String, Map<String, Boolean>> mailboxIds = new HashMap<>();
        Map<String, List<String>> customKeywords = new HashMap<>();

        if (!ids.isEmpty()) {
            for (AccountMessage message : accountMessageMapper.findByIds(accountId, ids)) {
                messages.put(message.getId(), message);
            }
        }
        if (!messages.isEmpty()) {
            List<String> found = new ArrayList<>(messages.keySet());
            List<String> canonicalIds = messages.values().stream().map(AccountMessage::getMessageId).distinct().toList();
            for (CanonicalMessage message : canonicalMessageMapper.findByIds(canonicalIds)) {
                canonical.put(message.getId(), message);
            }
            for (MailboxMembership membership : accountMessageMapper.findMemberships(found)) {
                mailboxIds.computeIfAbsent(membership.getAccountMessageId(), k -> new LinkedHashMap<>())
                        .put(membership.getMailboxId(), true);
            }
            for (EmailKeyword keyword : accountMessageMapper.findKeywordsFor(found)) {
                customKeywords.computeIfAbsent(keyword.getAccountMessageId(), k -> new ArrayList<>())
                        .add(keyword.getKeyword());
            }
        }

        List<String> requested = args.getProperties() == null ? DEFAULT_EMAIL_PROPERTIES : args.getProperties();
        List<Map<String, Object>> list = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        for (String id : ids) {
            AccountMessage message = messages.get(id);
            CanonicalMessage stored = message == null ? null : canonical.get(message.getMessageId());
            if (stored == null) {
                notFound.add(id);
                continue;
            }
            list.add(toJmap(message, stored,
                    mailboxIds.getOrDefault(id, Map.of()),
                    customKeywords.getOrDefault(id, List.of()),
                    new HashSet<>(requested), args));
        }
        return new GetResponse(accountId, state, list, notFound);
    }

    /**
     * Email/query; only receivedAt sorting is supported
     */
    public QueryResponse query(String accountId, EmailQueryArgs args) {
        if (args.getPosition() < 0) {
            throw JmapException.invalidArguments("position must not be negative");
        }
        int maxLimit = properties.getLimits().getMaxObjectsInGet();
        int limit = args.getLimit() == null ? maxLimit : args.getLimit();
        if (limit < 0) {
            throw JmapException.invalidArguments("limit must not be negative");
        }
        limit = Math.min(limit, maxLimit);

        EmailQueryFilter filter = toFilter(accountId, args);
        List<String> ids = new ArrayList<>();
        Integer total = null;

        if (args.isCollapseThreads()) {
            filter.setOffset(0);
            filter.setLimit(-1);
            Set<String> seenThreads = new LinkedHashSet<>();
            List<String> collapsed = new ArrayList<>();
            for (AccountMessage message : accountMessageMapper.query(filter)) {
                if (seenThreads.add(message.getThreadId())) {
                    collapsed.add(message.getId());
                }
            }
            int from = Math.min(args.getPosition(), collapsed.size());
            int to = Math.min(from + limit, collapsed.size());
            ids.addAll(collapsed.subList(from, to));
            if (args.isCalculateTotal()) {
                total = collapsed.size();
            }
        } else {
            filter.setOffset(args.getPosition());
            filter.setLimit(limit);
            for (AccountMessage message : accountMessageMapper.query(filter)) {
                ids.add(message.getId());
            }
            if (args.isCalculateTotal()) {
                total = accountMessageMapper.count(filter);
            }
        }

        QueryResponse response = new QueryResponse();
        response.setAccountId(accountId);
        response.setQueryState(changeLogService.getState(accountId, JmapType.EMAIL));
        response.setCanCalculateChanges(false);
        response.setPosition(args.getPosition());
        response.setIds(ids);
        response.setTotal(total);
        response.setLimit(args.getLimit() != null && args.getLimit() > maxLimit ? maxLimit : null);
        return response;
    }

    EmailQueryFilter toFilter(String accountId, EmailQueryArgs args) {
        boolean ascending = false;
        if (args.getSort() != null) {
            for (EmailQueryArgs.Comparator comparator : args.getSort()) {
                if (!"receivedAt".equals(comparator.getProperty())) {
                    throw new JmapException(JmapErrorType.INVALID_ARGUMENTS,
                            "Unsupported sort property: " + comparator.getProperty());
                }
                ascending = Boolean.TRUE.equals(comparator.getIsAscending());
            }
        }

        EmailQueryFilter filter = EmailQueryFilter.builder()
                .accountId(accountId)
                .ascending(ascending)
                .build();
        EmailQueryArgs.Filter condition = args.getFilter();
        if (condition == null) {
            return filter;
        }
        filter.setInMailbox(condition.getInMailbox());
        filter.setInThread(condition.getInThread());
        if (condition.getHasKeyword() != null) {
            String keyword = KeywordSupport.normalize(condition.getHasKeyword());
            if (KeywordSupport.isFlag(keyword)) {
                filter.setHasFlag(keyword.substring(1));
            } else {
                filter.setHasKeyword(keyword);
            }
        }
        if (condition.getNotKeyword() != null) {
            String keyword = KeywordSupport.normalize(condition.getNotKeyword());
            if (KeywordSupport.isFlag(keyword)) {
                filter.setNotFlag(keyword.substring(1));
            } else {
                filter.setNotKeyword(keyword);
            }
        }
        if (condition.getText() != null && !condition.getText().isBlank()) {
            filter.setText("%" + escapeLike(condition.getText().trim()) + "%");
        }
        return filter;
    }

    /**
     * Thread/get; emailIds ordered by internal date
     */
    public GetResponse getThreads(String accountId, GetArgs args) {
        if (args.getIds() == null) {
            throw JmapException.invalidArguments("ids is required for Thread/get");
        }
        checkGetLimit(args.getIds().size());
        String state = changeLogService.getState(accountId, JmapType.THREAD);

        List<Map<String, Object>> list = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        for (String id : new LinkedHashSet<>(args.getIds())) {
            MailThread thread = threadMapper.findById(accountId, id);
            if (thread == null) {
                notFound.add(id);
                continue;
            }
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("id", thread.getId());
            view.put("emailIds", threadMapper.findEmailIds(thread.getId()));
            list.add(view);
        }
        return new GetResponse(accountId, state, list, notFound);
    }

    private Map<String, Object> toJmap(AccountMessage message, CanonicalMessage stored,
                                       Map<String, Boolean> mailboxIds, List<String> custom,
                                       Set<String> requested, EmailGetArgs args) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", message.getId());
        if (requested.contains("blobId")) view.put("blobId", stored.getRawBlobSha256());
        if (requested.contains("threadId")) view.put("threadId", message.getThreadId());
        if (requested.contains("mailboxIds")) view.put("mailboxIds", mailboxIds);
        if (requested.contains("keywords")) {
            view.put("keywords", KeywordSupport.toJmap(message.isSeen(), message.isFlagged(),
                    message.isAnswered(), message.isDraft(), custom));
        }
        if (requested.contains("size")) view.put("size", stored.getSize());
        if (requested.contains("receivedAt")) view.put("receivedAt", message.getInternalDate());
        if (requested.contains("messageId")) {
            view.put("messageId", stored.getMessageId() == null ? null : List.of(stored.getMessageId()));
        }
        if (requested.contains("inReplyTo")) {
            view.put("inReplyTo", stored.getInReplyTo() == null ? null : List.of(stored.getInReplyTo()));
        }
        if (requested.contains("references")) {
            List<String> references = readList(stored.getReferencesJson());
            view.put("references", references.isEmpty() ? null : references);
        }
        if (ADDRESS_KINDS.stream().anyMatch(requested::contains)) {
            Map<String, List<EmailAddress>> addresses = addresses(stored.getId());
            for (String kind : ADDRESS_KINDS) {
                if (requested.contains(kind)) {
                    view.put(kind, addresses.get(kind));
                }
            }
        }
        if (requested.contains("subject")) view.put("subject", stored.getSubject());
        if (requested.contains("sentAt")) view.put("sentAt", stored.getSentAt());
        if (requested.contains("hasAttachment")) view.put("hasAttachment", stored.isHasAttachment());
        if (requested.contains("preview")) view.put("preview", stored.getSnippet() == null ? "" : stored.getSnippet());

        BodyPart structure = readStructure(stored.getBodyStructureJson());
        BodyPart textPart = findInline(structure, "text/plain");
        BodyPart htmlPart = findInline(structure, "text/html");
        if (requested.contains("bodyStructure")) view.put("bodyStructure", structure);
        if (requested.contains("textBody")) {
            view.put("textBody", textPart != null ? List.of(textPart) : htmlPart != null ? List.of(htmlPart) : List.of());
        }
        if (requested.contains("htmlBody")) {
            view.put("htmlBody", htmlPart != null ? List.of(htmlPart) : textPart != null ? List.of(textPart) : List.of());
        }
        if (requested.contains("attachments")) {
            List<BodyPart> attachments = new ArrayList<>();
            collectAttachments(structure, attachments);
            view.put("attachments", attachments);
        }
        if (requested.contains("bodyValues")) {
            Map<String, Object> values = new LinkedHashMap<>();
            int max = args.getMaxBodyValueBytes() == null ? 0 : args.getMaxBodyValueBytes();
            if ((args.isFetchTextBodyValues() || args.isFetchAllBodyValues()) && textPart != null) {
                values.put(textPart.getPartId(), bodyValue(stored.getTextBody(), stored.isTextBodyTruncated(), max));
            }
            if ((args.isFetchHTMLBodyValues() || args.isFetchAllBodyValues()) && htmlPart != null) {
                values.put(htmlPart.getPartId(), bodyValue(stored.getHtmlBody(), stored.isHtmlBodyTruncated(), max));
            }
            view.put("bodyValues", values);
        }
        return view;
    }

    private Map<String, List<EmailAddress>> addresses(String canonicalId) {
        Map<String, List<EmailAddress>> addresses = new HashMap<>();
        for (MessageAddress address : canonicalMessageMapper.findAddresses(canonicalId)) {
            addresses.computeIfAbsent(address.getKind(), k -> new ArrayList<>())
                    .add(new EmailAddress(address.getName(), address.getEmail()));
        }
        return addresses;
    }

    private Map<String, Object> bodyValue(String value, boolean storedTruncated, int maxBytes) {
        String text = value == null ? "" : value;
        boolean truncated = storedTruncated;
        if (maxBytes > 0) {
            byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
            if (bytes.length > maxBytes) {
                text = truncateUtf8(text, maxBytes);
                truncated = true;
            }
        }
        Map<String, Object> bodyValue = new LinkedHashMap<>();
        bodyValue.put("value", text);
        bodyValue.put("isEncodingProblem", false);
        bodyValue.put("isTruncated", truncated);
        return bodyValue;
    }

    static String truncateUtf8(String text, int maxBytes) {
        int bytes = 0;
        int end = 0;
        while (end < text.length()) {
            int codePoint = text.codePointAt(end);
            int size = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + size > maxBytes) {
                break;
            }
            bytes += size;
            end += Character.charCount(codePoint);
        }
        return text.substring(0, end);
    }

    private BodyPart findInline(BodyPart part, String type) {
        if (part == null) {
            return null;
        }
        if (part.getSubParts() != null) {
            for (BodyPart child : part.getSubParts()) {
                BodyPart found = findInline(child, type);
                if (found != null) {
                    return found;
                }
            }
            return null;
        }
        return part.getBlobId() == null && type.equals(part.getType()) ? part : null;
    }

    private void collectAttachments(BodyPart part, List<BodyPart> out) {
        if (part == null) {
            return;
        }
        if (part.getSubParts() != null) {
            for (BodyPart child : part.getSubParts()) {
                collectAttachments(child, out);
            }
        } else if (part.getBlobId() != null) {
            out.add(part);
        }
    }

    private BodyPart readStructure(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, BodyPart.class);
        } catch (JsonProcessingException e) {
            log.warn("Stored body structure is not readable", e);
            return null;
        }
    }

    private List<String> readList(String json) {
        if (json == null) {
            return List.of();
        }
        try {
            return List.of(objectMapper.readValue(json, String[].class));
        } catch (JsonProcessingException e) {
            log.warn("Stored references are not readable", e);
            return List.of();
        }
    }

    private void checkGetLimit(int count) {
        if (count > properties.getLimits().getMaxObjectsInGet()) {
            throw new JmapException(JmapErrorType.LIMIT_EXCEEDED,
                    "Too many ids, maximum is " + properties.getLimits().getMaxObjectsInGet());
        }
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
