package com.jmapmail.service;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.ChangeLogEntry;
import com.jmapmail.domain.ChangeOp;
import com.jmapmail.domain.JmapType;
import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.mapper.ChangeLogMapper;
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
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ChangeLogService unit tests
 */
@ExtendWith(MockitoExtension.class)
class ChangeLogServiceTest {

    private static final String ACCOUNT = "acc1";

    @Mock
    private ChangeLogMapper changeLogMapper;

    private ServerProperties properties;
    private ChangeLogService changeLogService;

    @BeforeEach
    void setUp() {
        properties = new ServerProperties();
        changeLogService = new ChangeLogService(changeLogMapper, properties,
                Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC));
    }

    private static ChangeLogEntry entry(String objectId, ChangeOp op, long modSeq, String props) {
        return ChangeLogEntry.builder()
                .accountId(ACCOUNT)
                .type(JmapType.EMAIL)
                .objectId(objectId)
                .op(op)
                .modSeq(modSeq)
                .updatedProperties(props)
                .build();
    }

    @Test
    @DisplayName("State is \"0\" before the first change")
    void testInitialState() {
        when(changeLogMapper.findState(ACCOUNT, JmapType.MAILBOX)).thenReturn(null);

        assertThat(changeLogService.getState(ACCOUNT, JmapType.MAILBOX)).isEqualTo("0");
    }

    @Test
    @DisplayName("record bumps the counter and writes one log row with the new modSeq")
    void testRecord() {
        when(changeLogMapper.findState(ACCOUNT, JmapType.MAILBOX)).thenReturn(3L);

        long modSeq = changeLogService.record(ACCOUNT, JmapType.MAILBOX, "mb1", ChangeOp.UPDATE,
                List.of("name", "name", "parentId"));

        ArgumentCaptor<ChangeLogEntry> captor = ArgumentCaptor.forClass(ChangeLogEntry.class);
        verify(changeLogMapper).incrementState(ACCOUNT, JmapType.MAILBOX);
        verify(changeLogMapper).insert(captor.capture());
        assertThat(modSeq).isEqualTo(3L);
        assertThat(captor.getValue().getModSeq()).isEqualTo(3L);
        assertThat(captor.getValue().getObjectId()).isEqualTo("mb1");
        assertThat(captor.getValue().getUpdatedProperties()).isEqualTo("name,parentId");
    }

    @Test
    @DisplayName("Created then destroyed in the window is omitted; last destroy wins; first create wins")
    void testCollapse() {
        List<ChangeLogEntry> entries = List.of(
                entry("a", ChangeOp.CREATE, 1, null),
                entry("a", ChangeOp.UPDATE, 2, "keywords"),
                entry("b", ChangeOp.CREATE, 3, null),
                entry("b", ChangeOp.DESTROY, 4, null),
                entry("c", ChangeOp.UPDATE, 5, "keywords"),
                entry("c", ChangeOp.DESTROY, 6, null),
                entry("d", ChangeOp.UPDATE, 7, "mailboxIds"));

        ChangeLogService.ChangeSet changes = ChangeLogService.collapse(entries, false);

        assertThat(changes.getCreated()).containsExactly("a");
        assertThat(changes.getUpdated()).containsExactly("d");
        assertThat(changes.getDestroyed()).containsExactly("c");
        assertThat(changes.getUpdatedProperties()).isNull();
    }

    @Test
    @DisplayName("updatedProperties is the union, or null when any row lacks properties")
    void testUpdatedProperties() {
        ChangeLogService.ChangeSet known = ChangeLogService.collapse(List.of(
                entry("a", ChangeOp.UPDATE, 1, "name"),
                entry("b", ChangeOp.UPDATE, 2, "sortOrder,name")), true);
        assertThat(known.getUpdatedProperties()).containsExactly("name", "sortOrder");

        ChangeLogService.ChangeSet unknown = ChangeLogService.collapse(List.of(
                entry("a", ChangeOp.UPDATE, 1, "name"),
                entry("b", ChangeOp.UPDATE, 2, null)), true);
        assertThat(unknown.getUpdatedProperties()).isNull();
    }

    @Test
    @DisplayName("Truncated result reports the last returned modSeq as newState")
    void testTruncatedChanges() {
        when(changeLogMapper.findState(ACCOUNT, JmapType.EMAIL)).thenReturn(10L);
        List<ChangeLogEntry> rows = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            rows.add(entry("e" + i, ChangeOp.CREATE, i, null));
        }
        when(changeLogMapper.findSince(ACCOUNT, JmapType.EMAIL, 0L, 3)).thenReturn(rows);

        ChangeLogService.ChangeSet changes = changeLogService.getChanges(ACCOUNT, JmapType.EMAIL, "0", 2, false);

        assertThat(changes.isHasMoreChanges()).isTrue();
        assertThat(changes.getOldState()).isEqualTo("0");
        assertThat(changes.getNewState()).isEqualTo("2");
        assertThat(changes.getCreated()).containsExactly("e1", "e2");
    }

    @Test
    @DisplayName("sinceState equal to the current state returns nothing without reading the log")
    void testNoChanges() {
        when(changeLogMapper.findState(ACCOUNT, JmapType.EMAIL)).thenReturn(4L);

        ChangeLogService.ChangeSet changes = changeLogService.getChanges(ACCOUNT, JmapType.EMAIL, "4", null, false);

        assertThat(changes.getNewState()).isEqualTo("4");
        assertThat(changes.isHasMoreChanges()).isFalse();
        assertThat(changes.getCreated()).isEmpty();
        verify(changeLogMapper, never()).findSince(eq(ACCOUNT), eq(JmapType.EMAIL), anyLong(), anyInt());
    }

    @Test
    @DisplayName("Future or malformed sinceState is cannotCalculateChanges")
    void testBadSinceState() {
        when(changeLogMapper.findState(ACCOUNT, JmapType.EMAIL)).thenReturn(4L);

        assertThatThrownBy(() -> changeLogService.getChanges(ACCOUNT, JmapType.EMAIL, "9", null, false))
                .isInstanceOf(JmapException.class)
                .extracting("type").isEqualTo(JmapErrorType.CANNOT_CALCULATE_CHANGES);
        assertThatThrownBy(() -> changeLogService.getChanges(ACCOUNT, JmapType.EMAIL, "abc", null, false))
                .isInstanceOf(JmapException.class)
                .extracting("type").isEqualTo(JmapErrorType.CANNOT_CALCULATE_CHANGES);
    }

    @Test
    @DisplayName("ifInState mismatch is stateMismatch")
    void testAssertInState() {
        when(changeLogMapper.findState(ACCOUNT, JmapType.MAILBOX)).thenReturn(2L);

        changeLogService.assertInState(ACCOUNT, JmapType.MAILBOX, "2");
        assertThatThrownBy(() -> changeLogService.assertInState(ACCOUNT, JmapType.MAILBOX, "1"))
                .isInstanceOf(JmapException.class)
                .extracting("type").isEqualTo(JmapErrorType.STATE_MISMATCH);
    }
}
