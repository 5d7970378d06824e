package com.jmapmail.service;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.ChangeLogEntry;
import com.jmapmail.domain.ChangeOp;
import com.jmapmail.domain.JmapType;
import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.mapper.ChangeLogMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Change/state tracking service
 * - One modSeq counter per (account, type), starting at 1
 * - Append-only change log, one entry per changed object
 * - /changes computation with create/update/destroy collapsing
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeLogService {

    private final ChangeLogMapper changeLogMapper;
    private final ServerProperties properties;
    private final Clock clock;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChangeSet {
        private String oldState;
        private String newState;
        private boolean hasMoreChanges;
        private List<String> created;
        private List<String> updated;
        private List<String> destroyed;
        private List<String> updatedProperties;
    }

    /**
     * Bump the (account, type) counter and return the new modSeq.
     * Must run inside the caller's transaction.
     */
    @Transactional
    public long bumpState(String accountId, JmapType type) {
        changeLogMapper.incrementState(accountId, type);
        Long modSeq = changeLogMapper.findState(accountId, type);
        if (modSeq == null) {
            throw new IllegalStateException("State row missing after increment: " + accountId + "/" + type);
        }
        return modSeq;
    }

    /**
     * Record one change of one object
     */
    @Transactional
    public long record(String accountId, JmapType type, String objectId, ChangeOp op,
                       Collection<String> updatedProperties) {
        long modSeq = bumpState(accountId, type);
        String props = updatedProperties == null || updatedProperties.isEmpty()
                ? null
                : String.join(",", new LinkedHashSet<>(updatedProperties));

        changeLogMapper.insert(ChangeLogEntry.builder()
                .id(UUID.randomUUID().toString())
                .accountId(accountId)
                .type(type)
                .objectId(objectId)
                .op(op)
                .modSeq(modSeq)
                .updatedProperties(props)
                .createdAt(clock.instant())
                .build());

        log.debug("Change recorded: {} {} {} modSeq={}", type.getJmapName(), op, objectId, modSeq);
        return modSeq;
    }

    public long record(String accountId, JmapType type, String objectId, ChangeOp op) {
        return record(accountId, type, objectId, op, null);
    }

    /**
     * Current state string, "0" before the first change
     */
    public String getState(String accountId, JmapType type) {
        Long modSeq = changeLogMapper.findState(accountId, type);
        return modSeq == null ? "0" : String.valueOf(modSeq);
    }

    /**
     * Session state: max modSeq over all types of the account
     */
    public String getSessionState(String accountId) {
        Long modSeq = changeLogMapper.findMaxState(accountId);
        return modSeq == null ? "0" : String.valueOf(modSeq);
    }

    /**
     * Fail with stateMismatch unless ifInState is absent or equals the current state
     */
    public void assertInState(String accountId, JmapType type, String ifInState) {
        if (ifInState == null) {
            return;
        }
        String current = getState(accountId, type);
        if (!current.equals(ifInState)) {
            throw new JmapException(JmapErrorType.STATE_MISMATCH,
                    "ifInState " + ifInState + " does not match current state " + current);
        }
    }

    /**
     * Changes of one type since the given state
     */
    public ChangeSet getChanges(String accountId, JmapType type, String sinceState, Integer maxChanges,
                                boolean includeUpdatedProperties) {
        long since = parseState(sinceState);
        long current = Long.parseLong(getState(accountId, type));
        if (since > current) {
            throw new JmapException(JmapErrorType.CANNOT_CALCULATE_CHANGES,
                    "sinceState " + sinceState + " is newer than the current state");
        }

        int limit = properties.getLimits().getMaxChanges();
        if (maxChanges != null) {
            if (maxChanges <= 0) {
                throw JmapException.invalidArguments("maxChanges must be a positive integer");
            }
            limit = Math.min(maxChanges, limit);
        }

        List<ChangeLogEntry> rows = since == current
                ? List.of()
                : changeLogMapper.findSince(accountId, type, since, limit + 1);

        boolean hasMore = rows.size() > limit;
        List<ChangeLogEntry> slice = hasMore ? rows.subList(0, limit) : rows;

        ChangeSet changes = collapse(slice, includeUpdatedProperties);
        changes.setOldState(sinceState);
        changes.setHasMoreChanges(hasMore);
        changes.setNewState(hasMore
                ? String.valueOf(slice.get(slice.size() - 1).getModSeq())
                : String.valueOf(current));
        return changes;
    }

    /**
     * Per object: created then destroyed is dropped, last op destroy is destroyed,
     * first op create is created, anything else is updated
     */
    static ChangeSet collapse(List<ChangeLogEntry> entries, boolean includeUpdatedProperties) {
        Map<String, ChangeOp[]> firstLast = new LinkedHashMap<>();
        Map<String, List<ChangeLogEntry>> byObject = new LinkedHashMap<>();

        for (ChangeLogEntry entry : entries) {
            ChangeOp[] ops = firstLast.get(entry.getObjectId());
            if (ops == null) {
                firstLast.put(entry.getObjectId(), new ChangeOp[]{entry.getOp(), entry.getOp()});
            } else {
                ops[1] = entry.getOp();
            }
            byObject.computeIfAbsent(entry.getObjectId(), k -> new ArrayList<>()).add(entry);
        }

        List<String> created = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<String> destroyed = new ArrayList<>();

        for (Map.Entry<String, ChangeOp[]> e : firstLast.entrySet()) {
            ChangeOp first = e.getValue()[0];
            ChangeOp last = e.getValue()[1];
            if (first == ChangeOp.CREATE && last == ChangeOp.DESTROY) {
                continue;
            }
            if (last == ChangeOp.DESTROY) {
                destroyed.add(e.getKey());
            } else if (first == ChangeOp.CREATE) {
                created.add(e.getKey());
            } else {
                updated.add(e.getKey());
            }
        }

        List<String> updatedProperties = null;
        if (includeUpdatedProperties && !updated.isEmpty()) {
            Set<String> union = new LinkedHashSet<>();
            boolean known = true;
            for (String id : updated) {
                for (ChangeLogEntry entry : byObject.get(id)) {
                    if (entry.getUpdatedProperties() == null) {
                        known = false;
                        break;
                    }
                    union.addAll(List.of(entry.getUpdatedProperties().split(",")));
                }
                if (!known) {
                    break;
                }
            }
            updatedProperties = known ? new ArrayList<>(union) : null;
        }

        return ChangeSet.builder()
                .created(created)
                .updated(updated)
                .destroyed(destroyed)
                .updatedProperties(updatedProperties)
                .build();
    }

    private long parseState(String state) {
        if (state == null || state.isBlank()) {
            throw JmapException.invalidArguments("sinceState is required");
        }
        try {
            long value = Long.parseLong(state.trim());
            if (value < 0) {
                throw new NumberFormatException(state);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new JmapException(JmapErrorType.CANNOT_CALCULATE_CHANGES, "Unknown state: " + state);
        }
    }
}
