package com.jmapmail.jmap.method;

import com.jmapmail.domain.JmapType;
import com.jmapmail.jmap.ChangesResponse;
import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapMethod;
import com.jmapmail.jmap.args.ChangesArgs;
import com.jmapmail.service.ChangeLogService;

/**
 * Foo/changes over the per-account change log
 */
public abstract class ChangesMethod implements JmapMethod<ChangesArgs> {

    private final ChangeLogService changeLogService;
    private final JmapType type;
    private final String capability;
    private final boolean includeUpdatedProperties;

    protected ChangesMethod(ChangeLogService changeLogService, JmapType type, String capability,
                            boolean includeUpdatedProperties) {
        this.changeLogService = changeLogService;
        this.type = type;
        this.capability = capability;
        this.includeUpdatedProperties = includeUpdatedProperties;
    }

    @Override
    public String name() {
        return type.getJmapName() + "/changes";
    }

    @Override
    public String capability() {
        return capability;
    }

    @Override
    public Class<ChangesArgs> argumentType() {
        return ChangesArgs.class;
    }

    @Override
    public Object handle(ChangesArgs args, InvocationContext context) {
        String accountId = context.getAccountId();
        return ChangesResponse.of(accountId, changeLogService.getChanges(accountId, type,
                args.getSinceState(), args.getMaxChanges(), includeUpdatedProperties));
    }
}
