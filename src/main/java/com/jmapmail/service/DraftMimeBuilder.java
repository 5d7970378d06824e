package com.jmapmail.service;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.EmailAddress;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.jmap.args.EmailCreate;
import com.jmapmail.util.EmlParser;
import jakarta.activation.DataHandler;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimePart;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;
import java.time.Clock;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Synthesizes an RFC 5322 message from structured draft fields.
 * text/plain, text/html or multipart/alternative, wrapped in multipart/mixed when attachments are present.
 */
@Component
@RequiredArgsConstructor
public class DraftMimeBuilder {

    private final ServerProperties properties;
    private final Clock clock;

    /**
     * @param attachmentData attachment bytes keyed by blobId
     */
    public byte[] build(EmailCreate draft, Map<String, byte[]> attachmentData) {
        try {
            MimeMessage message = new MimeMessage(EmlParser.getSession());

            List<EmailAddress> from = draft.getFrom();
            if (from != null && !from.isEmpty()) {
                message.addFrom(toAddresses(from, "from"));
            }
            setRecipients(message, Message.RecipientType.TO, draft.getTo(), "to");
            setRecipients(message, Message.RecipientType.CC, draft.getCc(), "cc");
            setRecipients(message, Message.RecipientType.BCC, draft.getBcc(), "bcc");
            if (draft.getReplyTo() != null && !draft.getReplyTo().isEmpty()) {
                message.setReplyTo(toAddresses(draft.getReplyTo(), "replyTo"));
            }
            message.setSubject(draft.getSubject() == null ? "" : draft.getSubject(), "UTF-8");
            message.setSentDate(Date.from(clock.instant()));

            if (draft.getInReplyTo() != null && !draft.getInReplyTo().isEmpty()) {
                message.setHeader("In-Reply-To", bracketed(draft.getInReplyTo()));
            }
            if (draft.getReferences() != null && !draft.getReferences().isEmpty()) {
                message.setHeader("References", bracketed(draft.getReferences()));
            }

            List<EmailCreate.AttachmentRef> attachments = draft.getAttachments();
            if (attachments == null || attachments.isEmpty()) {
                applyContent(message, draft.getTextBody(), draft.getHtmlBody());
            } else {
                MimeBodyPart content = new MimeBodyPart();
                applyContent(content, draft.getTextBody(), draft.getHtmlBody());
                MimeMultipart mixed = new MimeMultipart("mixed");
                mixed.addBodyPart(content);
                for (EmailCreate.AttachmentRef ref : attachments) {
                    mixed.addBodyPart(attachmentPart(ref, attachmentData.get(ref.getBlobId())));
                }
                message.setContent(mixed);
            }

            message.saveChanges();
            message.setHeader("Message-ID", "<" + UUID.randomUUID() + "@" + properties.getAdvertisedHostname() + ">");
            return EmlParser.toBytes(message);
        } catch (JmapException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Draft MIME build failed", e);
        }
    }

    private void applyContent(MimePart part, String text, String html) throws MessagingException {
        if (text != null && html != null) {
            MimeMultipart alternative = new MimeMultipart("alternative");
            MimeBodyPart plainPart = new MimeBodyPart();
            plainPart.setText(normalizeLineEndings(text), "UTF-8", "plain");
            MimeBodyPart htmlPart = new MimeBodyPart();
            htmlPart.setText(normalizeLineEndings(html), "UTF-8", "html");
            alternative.addBodyPart(plainPart);
            alternative.addBodyPart(htmlPart);
            part.setContent(alternative);
        } else if (html != null) {
            part.setText(normalizeLineEndings(html), "UTF-8", "html");
        } else {
            part.setText(normalizeLineEndings(text == null ? "" : text), "UTF-8", "plain");
        }
    }

    private MimeBodyPart attachmentPart(EmailCreate.AttachmentRef ref, byte[] data) throws MessagingException {
        if (data == null) {
            throw JmapException.invalidProperties("Attachment blob not found: " + ref.getBlobId(), "attachments");
        }
        String type = ref.getType() == null ? "application/octet-stream" : ref.getType();
        MimeBodyPart part = new MimeBodyPart();
        part.setDataHandler(new DataHandler(new ByteArrayDataSource(data, type)));
        part.setHeader("Content-Type", type);
        if (ref.getName() != null) {
            part.setFileName(ref.getName());
        }
        part.setDisposition("inline".equalsIgnoreCase(ref.getDisposition()) ? Part.INLINE : Part.ATTACHMENT);
        if (ref.getCid() != null) {
            part.setContentID("<" + ref.getCid() + ">");
        }
        return part;
    }

    private void setRecipients(MimeMessage message, Message.RecipientType type, List<EmailAddress> addresses,
                               String property) throws MessagingException {
        if (addresses != null && !addresses.isEmpty()) {
            message.setRecipients(type, toAddresses(addresses, property));
        }
    }

    private InternetAddress[] toAddresses(List<EmailAddress> addresses, String property) {
        InternetAddress[] result = new InternetAddress[addresses.size()];
        for (int i = 0; i < addresses.size(); i++) {
            EmailAddress address = addresses.get(i);
            if (address == null || address.getEmail() == null || address.getEmail().isBlank()) {
                throw JmapException.invalidProperties("Address without email in " + property, property);
            }
            try {
                result[i] = new InternetAddress(address.getEmail().trim(), address.getName(), "UTF-8");
            } catch (UnsupportedEncodingException e) {
                throw JmapException.invalidProperties("Invalid address in " + property, property);
            }
        }
        return result;
    }

    private String bracketed(List<String> ids) {
        return ids.stream()
                .map(EmlParser::normalizeMessageId)
                .filter(id -> id != null)
                .map(id -> "<" + id + ">")
                .collect(Collectors.joining(" "));
    }

    private String normalizeLineEndings(String value) {
        return value.replace("\r\n", "\n").replace("\n", "\r\n");
    }
}
