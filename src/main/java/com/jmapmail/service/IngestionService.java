package com.jmapmail.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.AccountMessage;
import com.jmapmail.domain.Attachment;
import com.jmapmail.domain.BodyPart;
import com.jmapmail.domain.CanonicalMessage;
import com.jmapmail.domain.ChangeOp;
import com.jmapmail.domain.EmailAddress;
import com.jmapmail.domain.JmapType;
import com.jmapmail.domain.MessageAddress;
import com.jmapmail.domain.MessageHeader;
import com.jmapmail.mapper.AccountMessageMapper;
import com.jmapmail.mapper.CanonicalMessageMapper;
import com.jmapmail.util.CryptoUtil;
import com.jmapmail.util.EmlParser;
import jakarta.mail.Header;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeUtility;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Ingestion pipeline: raw MIME bytes to canonical message and account view
 * - Parse headers, addresses and body structure (Jakarta Mail)
 * - Blob-worthy parts are content addressed, text bodies are inlined
 * - Canonical message is deduplicated by ingestId (SHA-256 of the raw bytes)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    static final List<String> ADDRESS_HEADERS = List.of("from", "sender", "to", "cc", "bcc", "reply-to");

    private final CanonicalMessageMapper canonicalMessageMapper;
    private final AccountMessageMapper accountMessageMapper;
    private final BlobService blobService;
    private final ThreadResolver threadResolver;
    private final ChangeLogService changeLogService;
    private final ServerProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Data
    @Builder
    public static class ParsedEmail {
        private MimeMessage mime;
        private List<MessageHeader> headers;
        private Map<String, List<EmailAddress>> addresses;   // keyed by from, sender, to, cc, bcc, replyTo
        private String subject;
        private String messageId;
        private String inReplyTo;
        private List<String> references;
        private Instant sentAt;
    }

    @Data
    @Builder
    public static class PreparedAttachment {
        private String partId;
        private String sha256;
        private byte[] data;
        private String filename;
        private String mimeType;
        private String disposition;
        private String contentId;
    }

    @Data
    @Builder
    public static class BodyStructure {
        private BodyPart structure;
        private List<PreparedAttachment> attachments;
        private String textBody;
        private String htmlBody;
    }

    /**
     * Parsed and structured message, ready to persist
     */
    @Data
    @Builder
    public static class PreparedMessage {
        private byte[] raw;
        private String ingestId;
        private ParsedEmail parsed;
        private BodyStructure body;

        public long getAttachmentSize() {
            long total = 0;
            for (PreparedAttachment attachment : body.getAttachments()) {
                if (attachment.getFilename() != null || "attachment".equals(attachment.getDisposition())) {
                    total += attachment.getData().length;
                }
            }
            return total;
        }
    }

    /**
     * Parse raw bytes into header fields and the MIME tree
     */
    public ParsedEmail parseRawEmail(byte[] raw) {
        try {
            MimeMessage mime = EmlParser.parse(raw);

            List<MessageHeader> headers = new ArrayList<>();
            Map<String, List<EmailAddress>> addresses = new LinkedHashMap<>();
            Enumeration<Header> all = mime.getAllHeaders();
            int position = 0;
            while (all.hasMoreElements()) {
                Header header = all.nextElement();
                String lowerName = header.getName().toLowerCase(Locale.ROOT);
                headers.add(MessageHeader.builder()
                        .position(position++)
                        .name(header.getName())
                        .lowerName(lowerName)
                        .value(header.getValue())
                        .build());
                if (ADDRESS_HEADERS.contains(lowerName)) {
                    String kind = "reply-to".equals(lowerName) ? "replyTo" : lowerName;
                    addresses.computeIfAbsent(kind, k -> new ArrayList<>()).addAll(parseAddresses(header.getValue()));
                }
            }

            return ParsedEmail.builder()
                    .mime(mime)
                    .headers(headers)
                    .addresses(addresses)
                    .subject(decode(mime.getHeader("Subject", null)))
                    .messageId(EmlParser.normalizeMessageId(mime.getHeader("Message-ID", null)))
                    .inReplyTo(firstMessageId(mime.getHeader("In-Reply-To", null)))
                    .references(EmlParser.parseReferences(mime.getHeader("References", " ")))
                    .sentAt(mime.getSentDate() == null ? null : mime.getSentDate().toInstant())
                    .build();
        } catch (Exception e) {
            log.error("Failed to parse raw email ({} bytes)", raw.length, e);
            throw new IllegalArgumentException("Unparseable MIME message", e);
        }
    }

    /**
     * Walk the MIME tree, assigning dotted part ids.
     * text/plain and text/html leaves without attachment disposition are inlined,
     * every other leaf is hashed for content addressing.
     */
    public BodyStructure buildBodyStructure(ParsedEmail parsed, long rawSize) {
        BodyStructure body = BodyStructure.builder().attachments(new ArrayList<>()).build();
        try {
            BodyPart root = walk(parsed.getMime(), null, body);
            if (root.getSize() == 0) {
                root.setSize(rawSize);
            }
            body.setStructure(root);
            return body;
        } catch (MessagingException | IOException e) {
            log.error("Failed to build body structure", e);
            throw new IllegalArgumentException("Invalid MIME structure", e);
        }
    }

    /**
     * Parse and structure without writing anything
     */
    public PreparedMessage prepare(byte[] raw) {
        ParsedEmail parsed = parseRawEmail(raw);
        return PreparedMessage.builder()
                .raw(raw)
                .ingestId(CryptoUtil.sha256Hex(raw))
                .parsed(parsed)
                .body(buildBodyStructure(parsed, raw.length))
                .build();
    }

    /**
     * Store the canonical message unless one with the same ingestId exists
     */
    @Transactional
    public CanonicalMessage upsertCanonicalMessage(PreparedMessage prepared) {
        CanonicalMessage existing = canonicalMessageMapper.findByIngestId(prepared.getIngestId());
        if (existing != null) {
            log.debug("Canonical message already stored: ingestId={}", prepared.getIngestId());
            return existing;
        }

        Instant now = clock.instant();
        String rawSha = blobService.store(prepared.getRaw()).getSha256();
        for (PreparedAttachment attachment : prepared.getBody().getAttachments()) {
            blobService.store(attachment.getData());
        }

        ParsedEmail parsed = prepared.getParsed();
        BodyStructure body = prepared.getBody();
        int maxBody = properties.getLimits().getMaxStoredBodyBytes();
        String textBody = truncate(body.getTextBody(), maxBody);
        String htmlBody = truncate(body.getHtmlBody(), maxBody);

        CanonicalMessage message = CanonicalMessage.builder()
                .id(UUID.randomUUID().toString())
                .ingestId(prepared.getIngestId())
                .rawBlobSha256(rawSha)
                .messageId(parsed.getMessageId())
                .inReplyTo(parsed.getInReplyTo())
                .referencesJson(toJson(parsed.getReferences()))
                .subject(parsed.getSubject())
                .snippet(EmlParser.makeSnippet(body.getTextBody(), body.getHtmlBody()))
                .sentAt(parsed.getSentAt())
                .size(prepared.getRaw().length)
                .hasAttachment(prepared.getAttachmentSize() > 0)
                .bodyStructureJson(toJson(body.getStructure()))
                .textBody(textBody)
                .textBodyTruncated(body.getTextBody() != null && textBody.length() < body.getTextBody().length())
                .htmlBody(htmlBody)
                .htmlBodyTruncated(body.getHtmlBody() != null && htmlBody.length() < body.getHtmlBody().length())
                .createdAt(now)
                .build();

        if (canonicalMessageMapper.insertIgnore(message) == 0) {
            // Lost a race with an identical ingestion
            return canonicalMessageMapper.findByIngestId(prepared.getIngestId());
        }

        storeHeaders(message.getId(), parsed.getHeaders());
        storeAddresses(message.getId(), parsed.getAddresses());
        storeAttachments(message.getId(), body.getAttachments());

        log.info("Canonical message stored: id={}, messageId={}, size={}",
                message.getId(), message.getMessageId(), message.getSize());
        return message;
    }

    /**
     * Create the per-account view of a canonical message: thread, flags, memberships, keywords.
     * Records Email create, Thread create/update and Mailbox updates for the touched mailboxes.
     */
    @Transactional
    public AccountMessage ingestForAccount(String accountId, CanonicalMessage message,
                                           Collection<String> mailboxIds, KeywordSupport.Split keywords,
                                           Instant internalDate) {
        return ingestForAccount(accountId, message, mailboxIds, keywords, internalDate, null);
    }

    /**
     * Same as above; a non-null threadId places the message in that thread instead of resolving one
     */
    @Transactional
    public AccountMessage ingestForAccount(String accountId, CanonicalMessage message,
                                           Collection<String> mailboxIds, KeywordSupport.Split keywords,
                                           Instant internalDate, String threadId) {
        Instant now = clock.instant();
        Instant received = internalDate != null ? internalDate : now;

        ThreadResolver.Resolution thread = threadId != null
                ? threadResolver.join(threadId, received)
                : threadResolver.resolveOrCreateThreadId(accountId, message.getSubject(), received,
                        message.getInReplyTo(), parseJsonList(message.getReferencesJson()));

        AccountMessage accountMessage = AccountMessage.builder()
                .id(UUID.randomUUID().toString())
                .accountId(accountId)
                .messageId(message.getId())
                .threadId(thread.getThreadId())
                .internalDate(received)
                .seen(keywords.isSeen())
                .flagged(keywords.isFlagged())
                .answered(keywords.isAnswered())
                .draft(keywords.isDraft())
                .deleted(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
        accountMessageMapper.insert(accountMessage);

        Collection<String> distinctMailboxes = new LinkedHashSet<>(mailboxIds);
        for (String mailboxId : distinctMailboxes) {
            accountMessageMapper.insertMembership(accountMessage.getId(), mailboxId, now);
        }
        for (String keyword : keywords.getCustom()) {
            accountMessageMapper.insertKeywordIgnore(accountMessage.getId(), keyword);
        }

        blobService.grant(accountId, message.getRawBlobSha256());
        for (Attachment attachment : canonicalMessageMapper.findAttachments(message.getId())) {
            blobService.grant(accountId, attachment.getBlobSha256());
        }

        changeLogService.record(accountId, JmapType.EMAIL, accountMessage.getId(), ChangeOp.CREATE);
        if (thread.isCreated()) {
            changeLogService.record(accountId, JmapType.THREAD, thread.getThreadId(), ChangeOp.CREATE);
        } else {
            changeLogService.record(accountId, JmapType.THREAD, thread.getThreadId(), ChangeOp.UPDATE,
                    List.of("emailIds"));
        }
        for (String mailboxId : distinctMailboxes) {
            changeLogService.record(accountId, JmapType.MAILBOX, mailboxId, ChangeOp.UPDATE,
                    MailboxService.COUNT_PROPERTIES);
        }

        log.debug("Account message created: account={}, email={}, thread={}",
                accountId, accountMessage.getId(), thread.getThreadId());
        return accountMessage;
    }

    public CanonicalMessage findCanonical(String canonicalMessageId) {
        return canonicalMessageMapper.findById(canonicalMessageId);
    }

    void storeHeaders(String messageId, List<MessageHeader> headers) {
        for (MessageHeader header : headers) {
            header.setMessageId(messageId);
            canonicalMessageMapper.insertHeader(header);
        }
    }

    void storeAddresses(String messageId, Map<String, List<EmailAddress>> addresses) {
        for (Map.Entry<String, List<EmailAddress>> entry : addresses.entrySet()) {
            int position = 0;
            for (EmailAddress address : entry.getValue()) {
                String email = CryptoUtil.normalizeEmail(address.getEmail());
                if (email == null) {
                    continue;
                }
                canonicalMessageMapper.insertAddressIgnore(UUID.randomUUID().toString(), email, address.getName());
                String addressId = canonicalMessageMapper.findAddressIdByEmail(email);
                canonicalMessageMapper.insertMessageAddress(MessageAddress.builder()
                        .messageId(messageId)
                        .addressId(addressId)
                        .kind(entry.getKey())
                        .position(position++)
                        .name(address.getName())
                        .build());
            }
        }
    }

    void storeAttachments(String messageId, List<PreparedAttachment> attachments) {
        int position = 0;
        for (PreparedAttachment prepared : attachments) {
            canonicalMessageMapper.insertAttachment(Attachment.builder()
                    .id(UUID.randomUUID().toString())
                    .messageId(messageId)
                    .partId(prepared.getPartId())
                    .blobSha256(prepared.getSha256())
                    .filename(prepared.getFilename())
                    .mimeType(prepared.getMimeType())
                    .disposition(prepared.getDisposition())
                    .contentId(prepared.getContentId())
                    .size(prepared.getData().length)
                    .position(position++)
                    .build());
        }
    }

    private BodyPart walk(Part part, String partId, BodyStructure body) throws MessagingException, IOException {
        ContentType contentType = contentType(part);
        String type = contentType.getBaseType().toLowerCase(Locale.ROOT);

        if (type.startsWith("multipart/")) {
            Multipart multipart = (Multipart) part.getContent();
            List<BodyPart> children = new ArrayList<>();
            long size = 0;
            for (int i = 0; i < multipart.getCount(); i++) {
                String childId = partId == null ? String.valueOf(i + 1) : partId + "." + (i + 1);
                BodyPart child = walk(multipart.getBodyPart(i), childId, body);
                size += child.getSize();
                children.add(child);
            }
            return BodyPart.builder().type(type).size(size).subParts(children).build();
        }

        String leafId = partId == null ? "1" : partId;
        String disposition = part.getDisposition() == null ? null : part.getDisposition().toLowerCase(Locale.ROOT);
        String filename = fileName(part);
        String charset = contentType.getParameter("charset");
        String cid = EmlParser.normalizeMessageId(firstHeader(part, "Content-ID"));

        boolean isText = "text/plain".equals(type) || "text/html".equals(type);
        boolean inline = isText && !"attachment".equals(disposition) && filename == null;

        if (inline) {
            String text = readText(part, charset);
            if ("text/plain".equals(type) && body.getTextBody() == null) {
                body.setTextBody(text);
            } else if ("text/html".equals(type) && body.getHtmlBody() == null) {
                body.setHtmlBody(text);
            }
            return BodyPart.builder()
                    .partId(leafId)
                    .type(type)
                    .charset(charset)
                    .disposition(disposition)
                    .size(text.getBytes(StandardCharsets.UTF_8).length)
                    .build();
        }

        byte[] data;
        try (InputStream in = part.getInputStream()) {
            data = in.readAllBytes();
        }
        String sha256 = CryptoUtil.sha256Hex(data);
        body.getAttachments().add(PreparedAttachment.builder()
                .partId(leafId)
                .sha256(sha256)
                .data(data)
                .filename(filename)
                .mimeType(type)
                .disposition(disposition)
                .contentId(cid)
                .build());

        return BodyPart.builder()
                .partId(leafId)
                .blobId(sha256)
                .size(data.length)
                .type(type)
                .charset(charset)
                .disposition(disposition)
                .name(filename)
                .cid(cid)
                .build();
    }

    private ContentType contentType(Part part) {
        try {
            String value = part.getContentType();
            return new ContentType(value == null ? "text/plain" : value);
        } catch (Exception e) {
            log.debug("Unparseable Content-Type, treating as application/octet-stream");
            try {
                return new ContentType("application/octet-stream");
            } catch (Exception impossible) {
                throw new IllegalStateException(impossible);
            }
        }
    }

    private String readText(Part part, String charset) throws MessagingException, IOException {
        byte[] data;
        try (InputStream in = part.getInputStream()) {
            data = in.readAllBytes();
        }
        Charset decoded = StandardCharsets.UTF_8;
        if (charset != null) {
            try {
                decoded = Charset.forName(MimeUtility.javaCharset(charset));
            } catch (Exception e) {
                log.debug("Unknown charset {}, decoding as UTF-8", charset);
            }
        }
        return new String(data, decoded);
    }

    private String fileName(Part part) {
        try {
            String name = part.getFileName();
            return name == null ? null : MimeUtility.decodeText(name);
        } catch (Exception e) {
            log.debug("Unreadable attachment file name: {}", e.getMessage());
            return null;
        }
    }

    private String firstHeader(Part part, String name) throws MessagingException {
        String[] values = part.getHeader(name);
        return values == null || values.length == 0 ? null : values[0];
    }

    private String firstMessageId(String header) {
        List<String> ids = EmlParser.parseReferences(header);
        return ids.isEmpty() ? null : ids.get(0);
    }

    private List<EmailAddress> parseAddresses(String value) {
        List<EmailAddress> result = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return result;
        }
        try {
            for (InternetAddress address : InternetAddress.parseHeader(value, false)) {
                if (address.getAddress() != null && !address.getAddress().isBlank()) {
                    result.add(new EmailAddress(address.getPersonal(), address.getAddress()));
                }
            }
        } catch (AddressException e) {
            log.debug("Skipping unparseable address header: {}", value);
        }
        return result;
    }

    private String decode(String value) {
        if (value == null) {
            return null;
        }
        try {
            return MimeUtility.decodeText(MimeUtility.unfold(value)).trim();
        } catch (Exception e) {
            return value.trim();
        }
    }

    private String truncate(String value, int maxChars) {
        if (value == null || value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, maxChars);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("JSON serialization failed", e);
        }
    }

    List<String> parseJsonList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return List.of(objectMapper.readValue(json, String[].class));
        } catch (JsonProcessingException e) {
            log.warn("Invalid stored references list: {}", json);
            return List.of();
        }
    }
}
