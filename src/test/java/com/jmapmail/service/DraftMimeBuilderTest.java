package com.jmapmail.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.EmailAddress;
import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.jmap.args.EmailCreate;
import com.jmapmail.mapper.AccountMessageMapper;
import com.jmapmail.mapper.CanonicalMessageMapper;
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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DraftMimeBuilder unit tests
 * Built drafts are read back through the same parser inbound mail uses.
 */
@ExtendWith(MockitoExtension.class)
class DraftMimeBuilderTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

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

    private DraftMimeBuilder draftMimeBuilder;
    private IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        ServerProperties properties = new ServerProperties();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        draftMimeBuilder = new DraftMimeBuilder(properties, clock);
        ingestionService = new IngestionService(canonicalMessageMapper, accountMessageMapper, blobService,
                threadResolver, changeLogService, properties, new ObjectMapper(), clock);
    }

    private static EmailCreate draft() {
        EmailCreate draft = new EmailCreate();
        draft.setFrom(List.of(new EmailAddress("Alice", "alice@example.com")));
        draft.setTo(List.of(new EmailAddress(null, "bob@example.com")));
        draft.setSubject("Lunch plans");
        return draft;
    }

    @Test
    @DisplayName("Text and HTML bodies become multipart/alternative")
    void testAlternativeBodies() {
        EmailCreate draft = draft();
        draft.setTextBody("Noon?\nCafe on 3rd");
        draft.setHtmlBody("<p>Noon?</p>");
        draft.setInReplyTo(List.of("<m1@example.com>"));

        IngestionService.PreparedMessage prepared = ingestionService.prepare(draftMimeBuilder.build(draft, Map.of()));

        assertThat(prepared.getParsed().getSubject()).isEqualTo("Lunch plans");
        assertThat(prepared.getParsed().getInReplyTo()).isEqualTo("m1@example.com");
        assertThat(prepared.getParsed().getMessageId()).isNotBlank();
        assertThat(prepared.getParsed().getAddresses().get("from").get(0).getName()).isEqualTo("Alice");
        assertThat(prepared.getParsed().getAddresses().get("to").get(0).getEmail()).isEqualTo("bob@example.com");
        assertThat(prepared.getBody().getStructure().getType()).isEqualTo("multipart/alternative");
        assertThat(prepared.getBody().getTextBody()).contains("Cafe on 3rd");
        assertThat(prepared.getBody().getHtmlBody()).contains("<p>Noon?</p>");
        assertThat(prepared.getBody().getAttachments()).isEmpty();
    }

    @Test
    @DisplayName("Attachments wrap the content in multipart/mixed")
    void testAttachment() {
        EmailCreate draft = draft();
        draft.setTextBody("See attached");
        draft.setAttachments(List.of(new EmailCreate.AttachmentRef("b1", "text/csv", "menu.csv", null, null)));

        byte[] raw = draftMimeBuilder.build(draft,
                Map.of("b1", "dish,price".getBytes(StandardCharsets.US_ASCII)));
        IngestionService.PreparedMessage prepared = ingestionService.prepare(raw);

        assertThat(prepared.getBody().getStructure().getType()).isEqualTo("multipart/mixed");
        assertThat(prepared.getBody().getTextBody()).contains("See attached");
        assertThat(prepared.getBody().getAttachments()).hasSize(1);
        assertThat(prepared.getBody().getAttachments().get(0).getFilename()).isEqualTo("menu.csv");
        assertThat(new String(prepared.getBody().getAttachments().get(0).getData(), StandardCharsets.US_ASCII))
                .isEqualTo("dish,price");
    }

    @Test
    @DisplayName("Missing attachment data and blank addresses are invalid properties")
    void testInvalidDraft() {
        EmailCreate missingBlob = draft();
        missingBlob.setAttachments(List.of(new EmailCreate.AttachmentRef("b9", null, null, null, null)));
        assertThatThrownBy(() -> draftMimeBuilder.build(missingBlob, Map.of()))
                .isInstanceOf(JmapException.class)
                .extracting("type").isEqualTo(JmapErrorType.INVALID_PROPERTIES);

        EmailCreate blankAddress = draft();
        blankAddress.setCc(List.of(new EmailAddress("Nobody", " ")));
        assertThatThrownBy(() -> draftMimeBuilder.build(blankAddress, Map.of()))
                .isInstanceOf(JmapException.class)
                .extracting("properties").isEqualTo(List.of("cc"));
    }
}
