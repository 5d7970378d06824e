package com.jmapmail.service;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.AccountMessage;
import com.jmapmail.domain.CanonicalMessage;
import com.jmapmail.domain.JmapType;
import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.jmap.SetResponse;
import com.jmapmail.jmap.args.EmailImportArgs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * EmailImportService unit tests
 */
@ExtendWith(MockitoExtension.class)
class EmailImportServiceTest {

    private static final String ACCOUNT = "acc";
    private static final String BLOB = "b".repeat(64);
    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    @Mock
    private BlobService blobService;

    @Mock
    private IngestionService ingestionService;

    @Mock
    private EmailSetService emailSetService;

    @Mock
    private ChangeLogService changeLogService;

    private EmailImportService importService;
    private InvocationContext context;

    @BeforeEach
    void setUp() {
        importService = new EmailImportService(blobService, ingestionService, emailSetService, changeLogService,
                new ServerProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        context = new InvocationContext(ACCOUNT);
    }

    private static EmailImportArgs args(EmailImportArgs.ImportEntry entry) {
        EmailImportArgs args = new EmailImportArgs();
        args.setEmails(Map.of("i1", entry));
        return args;
    }

    @Test
    @DisplayName("Import ingests the uploaded blob into the requested mailboxes")
    void testImport() {
        Map<String, Boolean> mailboxes = Map.of("inbox", true);
        byte[] raw = "Subject: hi\r\n\r\nbody".getBytes();
        IngestionService.PreparedMessage prepared = IngestionService.PreparedMessage.builder()
                .raw(raw)
                .body(IngestionService.BodyStructure.builder().attachments(List.of()).build())
                .build();
        CanonicalMessage canonical = CanonicalMessage.builder().id("C1").rawBlobSha256(BLOB).size(raw.length).build();
        AccountMessage message = AccountMessage.builder().id("E1").accountId(ACCOUNT).messageId("C1").threadId("T1").build();
        Instant receivedAt = Instant.parse("2023-12-24T10:00:00Z");

        when(changeLogService.getState(ACCOUNT, JmapType.EMAIL)).thenReturn("3");
        when(emailSetService.resolveMailboxes(ACCOUNT, mailboxes, context)).thenReturn(List.of("inbox"));
        when(blobService.readForAccount(ACCOUNT, BLOB)).thenReturn(raw);
        when(ingestionService.prepare(raw)).thenReturn(prepared);
        when(ingestionService.upsertCanonicalMessage(prepared)).thenReturn(canonical);
        when(ingestionService.ingestForAccount(eq(ACCOUNT), same(canonical), eq(List.of("inbox")),
                any(KeywordSupport.Split.class), eq(receivedAt))).thenReturn(message);
        when(ingestionService.findCanonical("C1")).thenReturn(canonical);

        SetResponse response = importService.importEmails(ACCOUNT,
                args(new EmailImportArgs.ImportEntry(BLOB, mailboxes, Map.of("$seen", true), receivedAt)), context);

        assertThat(response.getCreated()).containsKey("i1");
        @SuppressWarnings("unchecked")
        Map<String, Object> created = (Map<String, Object>) response.getCreated().get("i1");
        assertThat(created).containsEntry("id", "E1").containsEntry("blobId", BLOB).containsEntry("threadId", "T1");
        assertThat(context.resolveId("#i1")).isEqualTo("E1");

        ArgumentCaptor<KeywordSupport.Split> keywords = ArgumentCaptor.forClass(KeywordSupport.Split.class);
        verify(ingestionService).ingestForAccount(eq(ACCOUNT), same(canonical), eq(List.of("inbox")),
                keywords.capture(), eq(receivedAt));
        assertThat(keywords.getValue().isSeen()).isTrue();
    }

    @Test
    @DisplayName("A blob the account never uploaded is blobNotFound")
    void testBlobNotFound() {
        Map<String, Boolean> mailboxes = Map.of("inbox", true);
        when(changeLogService.getState(ACCOUNT, JmapType.EMAIL)).thenReturn("3");
        when(emailSetService.resolveMailboxes(ACCOUNT, mailboxes, context)).thenReturn(List.of("inbox"));

        SetResponse response = importService.importEmails(ACCOUNT,
                args(new EmailImportArgs.ImportEntry(BLOB, mailboxes, null, null)), context);

        assertThat(response.getNotCreated().get("i1").getType()).isEqualTo(JmapErrorType.BLOB_NOT_FOUND);
        verify(ingestionService, never()).prepare(any());
    }

    @Test
    @DisplayName("An empty emails map is invalidArguments")
    void testEmptyImport() {
        assertThatThrownBy(() -> importService.importEmails(ACCOUNT, new EmailImportArgs(), context))
                .isInstanceOf(JmapException.class)
                .extracting("type").isEqualTo(JmapErrorType.INVALID_ARGUMENTS);
    }
}
