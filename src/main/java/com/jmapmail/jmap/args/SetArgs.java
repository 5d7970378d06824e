package com.jmapmail.jmap.args;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;
import java.util.Map;

/**
 * Foo/set arguments: typed create objects, patch-object updates
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class SetArgs<C> extends MethodArgs {

    private String ifInState;
    private Map<String, C> create;
    private Map<String, Map<String, Object>> update;
    private List<String> destroy;

    @JsonIgnore
    public int objectCount() {
        return (create == null ? 0 : create.size())
                + (update == null ? 0 : update.size())
                + (destroy == null ? 0 : destroy.size());
    }
}
