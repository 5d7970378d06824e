package com.jmapmail.jmap;

import lombok.Getter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-request state shared by the method calls of one JMAP request
 * - Creation id to server id map (#creationId references)
 * - Implicit responses emitted after the current call (Email/set after copy or submission)
 */
public class InvocationContext {

    @Getter
    private final String accountId;
    private final Map<String, String> createdIds;
    private final List<Invocation> implicitResponses = new ArrayList<>();

    public InvocationContext(String accountId) {
        this(accountId, null);
    }

    public InvocationContext(String accountId, Map<String, String> createdIds) {
        this.accountId = accountId;
        this.createdIds = createdIds == null ? new HashMap<>() : new HashMap<>(createdIds);
    }

    public void putCreatedId(String creationId, String id) {
        createdIds.put(creationId, id);
    }

    /**
     * Resolve "#creationId" to the server id; plain ids pass through.
     * @return null for an unknown creation id
     */
    public String resolveId(String id) {
        if (id == null || !id.startsWith("#")) {
            return id;
        }
        return createdIds.get(id.substring(1));
    }

    public boolean isCreationReference(String id) {
        return id != null && id.startsWith("#");
    }

    public Map<String, String> getCreatedIds() {
        return createdIds;
    }

    public void addImplicitResponse(String name, Object arguments) {
        implicitResponses.add(new Invocation(name, arguments, null));
    }

    /**
     * Drain implicit responses queued by the last call
     */
    public List<Invocation> takeImplicitResponses() {
        List<Invocation> taken = new ArrayList<>(implicitResponses);
        implicitResponses.clear();
        return taken;
    }
}
