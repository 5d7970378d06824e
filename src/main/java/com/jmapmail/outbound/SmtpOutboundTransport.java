package com.jmapmail.outbound;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.service.BlobService;
import com.jmapmail.util.CryptoUtil;
import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.angus.mail.smtp.SMTPAddressFailedException;
import org.eclipse.angus.mail.smtp.SMTPSendFailedException;
import org.eclipse.angus.mail.smtp.SMTPTransport;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * SMTP outbound transport (Jakarta Mail)
 * - Relay mode: everything goes to the configured smart host, authenticated when credentials are set
 * - Direct mode: recipients are grouped by domain and handed to the domain's MX hosts in order
 * - 5xx replies are permanent rejections, 4xx replies transient ones
 * - Connection failures are thrown to the caller
 * - Socket timeouts are capped by the queue's send budget
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SmtpOutboundTransport implements OutboundTransport {

    static final String TAG_HEADER = "X-SES-MESSAGE-TAGS";
    private static final int SMTP_PORT = 25;

    private final ServerProperties properties;
    private final BlobService blobService;
    private final MxResolver mxResolver;

    @Override
    public OutboundResult send(OutboundRequest request) throws MessagingException {
        byte[] raw = blobService.read(request.getRawBlobSha256());
        if (raw == null) {
            return OutboundResult.failed("Raw MIME blob not found for sha256=" + request.getRawBlobSha256());
        }

        ServerProperties.Outbound outbound = properties.getOutbound();
        if (outbound.hasRelay()) {
            return deliver(outbound.getRelayHost(), outbound.getRelayPort(), true, raw, request, request.getRcptTo());
        }

        for (String recipient : request.getRcptTo()) {
            if (CryptoUtil.extractDomain(recipient) == null) {
                return OutboundResult.rejected(true, "Invalid recipient address: " + recipient);
            }
        }
        List<String> replies = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : groupByDomain(request.getRcptTo()).entrySet()) {
            OutboundResult result = deliverToDomain(entry.getKey(), entry.getValue(), raw, request);
            if (!result.isAccepted()) {
                return result;
            }
            replies.add(result.getProviderMessageId());
        }
        return OutboundResult.accepted(String.join(",", replies), "Accepted by outbound transport");
    }

    private OutboundResult deliverToDomain(String domain, List<String> recipients, byte[] raw,
                                           OutboundRequest request) throws MessagingException {
        MessagingException lastError = null;
        for (String host : mxResolver.resolve(domain)) {
            try {
                return deliver(host, SMTP_PORT, false, raw, request, recipients);
            } catch (MessagingException e) {
                log.warn("Delivery to {} via {} failed: {}", domain, host, e.getMessage());
                lastError = e;
            }
        }
        if (lastError == null) {
            throw new MessagingException("No MX host for " + domain);
        }
        throw lastError;
    }

    OutboundResult deliver(String host, int port, boolean relay, byte[] raw, OutboundRequest request,
                           List<String> recipients) throws MessagingException {
        Session session = Session.getInstance(sessionProperties(host, port, relay, request.getMailFrom()));
        MimeMessage message = new MimeMessage(session, new ByteArrayInputStream(raw));
        message.setHeader(TAG_HEADER, "submissionId=" + request.getSubmissionId());

        SMTPTransport transport = (SMTPTransport) session.getTransport("smtp");
        try {
            ServerProperties.Outbound outbound = properties.getOutbound();
            if (relay && outbound.hasCredentials()) {
                transport.connect(host, port, outbound.getUsername(), outbound.getPassword());
            } else {
                transport.connect(host, port, null, null);
            }
            transport.sendMessage(message, toAddresses(recipients));
            String reply = transport.getLastServerResponse();
            log.info("Submission {} accepted by {}: {}", request.getSubmissionId(), host, reply);
            return OutboundResult.accepted(providerMessageId(reply), reply);
        } catch (SendFailedException e) {
            int code = replyCode(e);
            log.warn("Submission {} refused by {} ({}): {}", request.getSubmissionId(), host, code, e.getMessage());
            return OutboundResult.rejected(code >= 500, e.getMessage());
        } finally {
            try {
                transport.close();
            } catch (MessagingException e) {
                log.debug("SMTP close failed for {}: {}", host, e.getMessage());
            }
        }
    }

    Properties sessionProperties(String host, int port, boolean relay, String mailFrom) {
        ServerProperties.Outbound outbound = properties.getOutbound();
        Properties props = new Properties();
        props.put("mail.smtp.host", host);
        props.put("mail.smtp.port", String.valueOf(port));
        props.put("mail.smtp.from", mailFrom);
        long budget = properties.getQueue().getSendTimeoutMs();
        props.put("mail.smtp.connectiontimeout", String.valueOf(Math.min(outbound.getConnectTimeoutMs(), budget)));
        props.put("mail.smtp.timeout", String.valueOf(Math.min(outbound.getReadTimeoutMs(), budget)));
        props.put("mail.smtp.writetimeout", String.valueOf(Math.min(outbound.getReadTimeoutMs(), budget)));
        props.put("mail.smtp.localhost", properties.getAdvertisedHostname());
        props.put("mail.smtp.starttls.enable", String.valueOf(outbound.isStarttls()));
        props.put("mail.smtp.starttls.required", String.valueOf(relay && outbound.isStarttls()));
        props.put("mail.smtp.auth", String.valueOf(relay && outbound.hasCredentials()));
        return props;
    }

    static Map<String, List<String>> groupByDomain(List<String> recipients) {
        Map<String, List<String>> byDomain = new LinkedHashMap<>();
        for (String recipient : recipients) {
            String domain = CryptoUtil.extractDomain(recipient);
            byDomain.computeIfAbsent(domain, d -> new ArrayList<>()).add(recipient);
        }
        return byDomain;
    }

    /**
     * "250 2.0.0 Ok: queued as 4F2C1" yields the queue id; other replies are kept whole
     */
    static String providerMessageId(String reply) {
        if (reply == null) {
            return null;
        }
        String trimmed = reply.trim();
        int idx = trimmed.toLowerCase().lastIndexOf("queued as ");
        if (idx >= 0) {
            String id = trimmed.substring(idx + "queued as ".length()).trim();
            return id.isEmpty() ? trimmed : id;
        }
        return trimmed;
    }

    static int replyCode(SendFailedException e) {
        if (e instanceof SMTPSendFailedException sendFailed) {
            return sendFailed.getReturnCode();
        }
        Exception next = e.getNextException();
        while (next != null) {
            if (next instanceof SMTPAddressFailedException addressFailed) {
                return addressFailed.getReturnCode();
            }
            next = next instanceof MessagingException messaging ? messaging.getNextException() : null;
        }
        return 0;
    }

    private static Address[] toAddresses(List<String> recipients) throws AddressException {
        Address[] addresses = new Address[recipients.size()];
        for (int i = 0; i < recipients.size(); i++) {
            addresses[i] = new InternetAddress(recipients.get(i));
        }
        return addresses;
    }
}
