package com.jmapmail.util;

import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * EML parsing utilities based on Jakarta Mail
 */
@Slf4j
public final class EmlParser {

    private static final Session SESSION;
    private static final Pattern BRACKETED_ID = Pattern.compile("<[^>]+>");
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int SNIPPET_LENGTH = 200;

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.decodetext.strict", "false");
        props.setProperty("mail.mime.address.strict", "false");
        SESSION = Session.getInstance(props);
    }

    private EmlParser() {}

    /**
     * Parse a MimeMessage from bytes
     */
    public static MimeMessage parse(byte[] emlData) throws Exception {
        try (InputStream is = new ByteArrayInputStream(emlData)) {
            return new MimeMessage(SESSION, is);
        }
    }

    /**
     * Serialize a MimeMessage to bytes
     */
    public static byte[] toBytes(MimeMessage message) throws Exception {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        message.writeTo(outputStream);
        return outputStream.toByteArray();
    }

    /**
     * Message-ID without angle brackets; null when absent or blank
     */
    public static String normalizeMessageId(String id) {
        if (id == null) return null;
        String trimmed = id.trim();
        if (trimmed.isEmpty()) return null;
        if (trimmed.startsWith("<") && trimmed.endsWith(">") && trimmed.length() > 2) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * Ordered Message-IDs of a References header.
     * Uses the bracketed ids when present, otherwise splits on whitespace.
     */
    public static List<String> parseReferences(String header) {
        List<String> ids = new ArrayList<>();
        if (header == null || header.isBlank()) return ids;

        Matcher matcher = BRACKETED_ID.matcher(header);
        while (matcher.find()) {
            String id = normalizeMessageId(matcher.group());
            if (id != null) ids.add(id);
        }
        if (!ids.isEmpty()) return ids;

        for (String part : WHITESPACE.split(header.trim())) {
            String id = normalizeMessageId(part);
            if (id != null) ids.add(id);
        }
        return ids;
    }

    /**
     * Preview text: first 200 chars of the plain body, else of the tag-stripped HTML body
     */
    public static String makeSnippet(String text, String html) {
        if (text != null && !text.isBlank()) {
            String collapsed = WHITESPACE.matcher(text.trim()).replaceAll(" ");
            return truncate(collapsed, SNIPPET_LENGTH);
        }
        if (html != null && !html.isBlank()) {
            String stripped = HTML_TAG.matcher(html).replaceAll(" ");
            stripped = WHITESPACE.matcher(stripped).replaceAll(" ").trim();
            if (!stripped.isEmpty()) {
                return truncate(stripped, SNIPPET_LENGTH);
            }
        }
        return null;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    /**
     * Return the mail Session
     */
    public static Session getSession() {
        return SESSION;
    }
}
