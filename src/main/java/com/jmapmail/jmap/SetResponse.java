package com.jmapmail.jmap;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Foo/set and Foo/copy response
 */
@Data
@NoArgsConstructor
public class SetResponse {

    private String accountId;
    private String fromAccountId;
    private String oldState;
    private String newState;
    private Map<String, Object> created;
    private Map<String, Object> updated;
    private List<String> destroyed;
    private Map<String, SetError> notCreated;
    private Map<String, SetError> notUpdated;
    private Map<String, SetError> notDestroyed;

    public SetResponse(String accountId, String oldState) {
        this.accountId = accountId;
        this.oldState = oldState;
    }

    public void addCreated(String creationId, Object value) {
        if (created == null) created = new LinkedHashMap<>();
        created.put(creationId, value);
    }

    public void addUpdated(String id, Object value) {
        if (updated == null) updated = new LinkedHashMap<>();
        updated.put(id, value);
    }

    public void addDestroyed(String id) {
        if (destroyed == null) destroyed = new ArrayList<>();
        destroyed.add(id);
    }

    public void addNotCreated(String creationId, SetError error) {
        if (notCreated == null) notCreated = new LinkedHashMap<>();
        notCreated.put(creationId, error);
    }

    public void addNotUpdated(String id, SetError error) {
        if (notUpdated == null) notUpdated = new LinkedHashMap<>();
        notUpdated.put(id, error);
    }

    public void addNotDestroyed(String id, SetError error) {
        if (notDestroyed == null) notDestroyed = new LinkedHashMap<>();
        notDestroyed.put(id, error);
    }
}
