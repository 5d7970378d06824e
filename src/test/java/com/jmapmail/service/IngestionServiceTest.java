package com.jmapmail.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.AccountMessage;
import com.jmapmail.domain.BodyPart;
import com.jmapmail.domain.CanonicalMessage;
import com.jmapmail.domain.ChangeOp;
import com.jmapmail.domain.JmapType;
import com.jmapmail.mapper.AccountMessageMapper;
import com.jmapmail.mapper.CanonicalMessageMapper;
import com.jmapmail.util.CryptoUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * IngestionService unit tests
 */
@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    private static final String RAW = String.join("\r\n",
            "From: Alice <alice@example.com>",
            "To: bob@example.com",
            "Subject: Hello",
            "Message-ID: <m1@example.com>",
            "MIME-Version: 1.0",
            "Content-Type: multipart/mixed; boundary=\"outer\"",
            "",
            "--outer",
            "Content-Type: multipart/alternative; boundary=\"inner\"",
            "",
            "--inner",
            "Content-Type: text/plain; charset=UTF-8",
            "",
            "Hi Bob",
            "--inner",
            "Content-Type: text/html; charset=UTF-8",
            "",
            "<p>Hi Bob</p>",
            "--inner--",
            "--outer",
            "Content-Type: application/pdf; name=\"a.pdf\"",
            "Content-Disposition: attachment; filename=\"a.pdf\"",
            "Content-Transfer-Encoding: base64",
            "",
            "JVBERi0xLjQ=",
            "--outer--",
            "");

    @Mock
    private CanonicalMessageMapper canonicalMessageMapper;

    @Mock
    private AccountMessageMapper accountMessageMapper;

    @Mock
    private BlobService blobService;

    @Mock
    private ThreadResolver threadResolver;

    @Mock
    private ChangeLogService changeLogService;

    private IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        ingestionService = new IngestionService(canonicalMessageMapper, accountMessageMapper, blobService,
                threadResolver, changeLogService, new ServerProperties(), new ObjectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Prepare splits inline bodies from content-addressed parts")
    void testPrepare() {
        byte[] raw = RAW.getBytes(StandardCharsets.US_ASCII);

        IngestionService.PreparedMessage prepared = ingestionService.prepare(raw);

        assertThat(prepared.getIngestId()).isEqualTo(CryptoUtil.sha256Hex(raw));
        assertThat(prepared.getParsed().getSubject()).isEqualTo("Hello");
        assertThat(prepared.getParsed().getMessageId()).isEqualTo("m1@example.com");
        assertThat(prepared.getParsed().getAddresses().get("from").get(0).getEmail()).isEqualTo("alice@example.com");
        assertThat(prepared.getParsed().getAddresses().get("from").get(0).getName()).isEqualTo("Alice");

        IngestionService.BodyStructure body = prepared.getBody();
        assertThat(body.getTextBody()).contains("Hi Bob");
        assertThat(body.getHtmlBody()).contains("<p>Hi Bob</p>");
        assertThat(body.getAttachments()).hasSize(1);
        assertThat(body.getAttachments().get(0).getPartId()).isEqualTo("2");
        assertThat(body.getAttachments().get(0).getFilename()).isEqualTo("a.pdf");
        assertThat(new String(body.getAttachments().get(0).getData(), StandardCharsets.US_ASCII)).isEqualTo("%PDF-1.4");
        assertThat(prepared.getAttachmentSize()).isEqualTo(8);

        BodyPart root = body.getStructure();
        assertThat(root.getType()).isEqualTo("multipart/mixed");
        assertThat(root.getSubParts()).hasSize(2);
        assertThat(root.getSubParts().get(0).getSubParts())
                .extracting(BodyPart::getPartId).containsExactly("1.1", "1.2");
        assertThat(root.getSubParts().get(1).getBlobId()).isEqualTo(body.getAttachments().get(0).getSha256());
    }

    @Test
    @DisplayName("Same raw bytes reuse the stored canonical message")
    void testIdempotentUpsert() {
        IngestionService.PreparedMessage prepared = ingestionService.prepare(RAW.getBytes(StandardCharsets.US_ASCII));
        CanonicalMessage stored = CanonicalMessage.builder().id("C1").ingestId(prepared.getIngestId()).build();
        when(canonicalMessageMapper.findByIngestId(prepared.getIngestId())).thenReturn(stored);

        assertThat(ingestionService.upsertCanonicalMessage(prepared)).isSameAs(stored);
        verify(blobService, never()).store(any());
        verify(canonicalMessageMapper, never()).insertIgnore(any());
    }

    @Test
    @DisplayName("Account view records email, thread and mailbox changes")
    void testIngestForAccount() {
        CanonicalMessage canonical = CanonicalMessage.builder()
                .id("C1").subject("Hi").rawBlobSha256("r".repeat(64)).build();
        when(threadResolver.resolveOrCreateThreadId("acc", "Hi", NOW, null, List.of()))
                .thenReturn(new ThreadResolver.Resolution("T1", true));

        AccountMessage message = ingestionService.ingestForAccount("acc", canonical, List.of("inbox", "inbox"),
                KeywordSupport.split(Map.of("$seen", true, "work", true)), null);

        assertThat(message.getThreadId()).isEqualTo("T1");
        assertThat(message.isSeen()).isTrue();
        assertThat(message.getInternalDate()).isEqualTo(NOW);
        verify(accountMessageMapper).insertMembership(message.getId(), "inbox", NOW);
        verify(accountMessageMapper).insertKeywordIgnore(message.getId(), "work");
        verify(blobService).grant("acc", "r".repeat(64));
        verify(changeLogService).record("acc", JmapType.EMAIL, message.getId(), ChangeOp.CREATE);
        verify(changeLogService).record("acc", JmapType.THREAD, "T1", ChangeOp.CREATE);
        verify(changeLogService).record("acc", JmapType.MAILBOX, "inbox", ChangeOp.UPDATE,
                MailboxService.COUNT_PROPERTIES);
    }
}
