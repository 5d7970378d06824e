package com.jmapmail.service;

import com.jmapmail.domain.AccountMessage;
import com.jmapmail.domain.CanonicalMessage;
import com.jmapmail.jmap.Invocation;
import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.jmap.SetResponse;
import com.jmapmail.jmap.args.EmailCopyArgs;
import com.jmapmail.jmap.args.EmailSetArgs;
import com.jmapmail.mapper.AccountMessageMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * EmailCopyService unit tests
 */
@ExtendWith(MockitoExtension.class)
class EmailCopyServiceTest {

    private static final String ACCOUNT = "acc";
    private static final Instant RECEIVED = Instant.parse("2024-04-01T08:00:00Z");

    @Mock
    private AccountMessageMapper accountMessageMapper;

    @Mock
    private IngestionService ingestionService;

    @Mock
    private EmailSetService emailSetService;

    @Mock
    private ChangeLogService changeLogService;

    private EmailCopyService copyService;
    private InvocationContext context;

    @BeforeEach
    void setUp() {
        copyService = new EmailCopyService(accountMessageMapper, ingestionService, emailSetService, changeLogService);
        context = new InvocationContext(ACCOUNT);
    }

    private void stubSourceCopy() {
        AccountMessage source = AccountMessage.builder()
                .id("E1").accountId(ACCOUNT).messageId("C1").threadId("T1").internalDate(RECEIVED).seen(true).build();
        CanonicalMessage canonical = CanonicalMessage.builder().id("C1").rawBlobSha256("r".repeat(64)).size(42).build();
        when(accountMessageMapper.findById(ACCOUNT, "E1")).thenReturn(source);
        when(accountMessageMapper.findKeywords("E1")).thenReturn(List.of("work"));
        when(emailSetService.resolveMailboxes(ACCOUNT, Map.of("archive", true), context)).thenReturn(List.of("archive"));
        when(ingestionService.findCanonical("C1")).thenReturn(canonical);
        when(ingestionService.ingestForAccount(eq(ACCOUNT), same(canonical), eq(List.of("archive")),
                any(KeywordSupport.Split.class), eq(RECEIVED), eq("T1")))
                .thenReturn(AccountMessage.builder().id("E2").messageId("C1").threadId("T1").build());
    }

    private static EmailCopyArgs copyArgs(boolean destroyOriginal) {
        EmailCopyArgs args = new EmailCopyArgs();
        args.setCreate(Map.of("k1", new EmailCopyArgs.CopyEntry("E1", Map.of("archive", true), null, null)));
        args.setOnSuccessDestroyOriginal(destroyOriginal);
        return args;
    }

    @Test
    @DisplayName("Copy keeps the source thread, date and keywords")
    @SuppressWarnings("unchecked")
    void testCopy() {
        stubSourceCopy();

        SetResponse response = copyService.copy(ACCOUNT, copyArgs(false), context);

        Map<String, Object> created = (Map<String, Object>) response.getCreated().get("k1");
        assertThat(created).containsEntry("id", "E2").containsEntry("threadId", "T1")
                .containsEntry("blobId", "r".repeat(64));
        assertThat(response.getFromAccountId()).isEqualTo(ACCOUNT);
        assertThat(context.resolveId("#k1")).isEqualTo("E2");

        ArgumentCaptor<KeywordSupport.Split> keywords = ArgumentCaptor.forClass(KeywordSupport.Split.class);
        verify(ingestionService).ingestForAccount(eq(ACCOUNT), any(), any(), keywords.capture(), any(), eq("T1"));
        assertThat(keywords.getValue().isSeen()).isTrue();
        assertThat(keywords.getValue().getCustom()).containsExactly("work");
        assertThat(context.takeImplicitResponses()).isEmpty();
    }

    @Test
    @DisplayName("onSuccessDestroyOriginal issues an implicit Email/set destroy of the source")
    void testDestroyOriginal() {
        stubSourceCopy();
        SetResponse destroyed = new SetResponse(ACCOUNT, "5");
        destroyed.addDestroyed("E1");
        when(emailSetService.set(eq(ACCOUNT), any(EmailSetArgs.class), same(context))).thenReturn(destroyed);

        copyService.copy(ACCOUNT, copyArgs(true), context);

        ArgumentCaptor<EmailSetArgs> setArgs = ArgumentCaptor.forClass(EmailSetArgs.class);
        verify(emailSetService).set(eq(ACCOUNT), setArgs.capture(), same(context));
        assertThat(setArgs.getValue().getDestroy()).containsExactly("E1");
        List<Invocation> implicit = context.takeImplicitResponses();
        assertThat(implicit).hasSize(1);
        assertThat(implicit.get(0).getName()).isEqualTo("Email/set");
        assertThat(implicit.get(0).getArguments()).isSameAs(destroyed);
    }

    @Test
    @DisplayName("A missing source is notFound and nothing is destroyed")
    void testMissingSource() {
        SetResponse response = copyService.copy(ACCOUNT, copyArgs(true), context);

        assertThat(response.getNotCreated().get("k1").getType()).isEqualTo(JmapErrorType.NOT_FOUND);
        verify(emailSetService, never()).set(anyString(), any(), any());
    }

    @Test
    @DisplayName("Copies between accounts are rejected")
    void testCrossAccount() {
        EmailCopyArgs args = copyArgs(false);
        args.setFromAccountId("other");

        assertThatThrownBy(() -> copyService.copy(ACCOUNT, args, context))
                .isInstanceOf(JmapException.class)
                .extracting("type").isEqualTo(JmapErrorType.INVALID_ARGUMENTS);
    }
}
