package com.jmapmail.jmap.args;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class ChangesArgs extends MethodArgs {

    private String sinceState;
    private Integer maxChanges;
}
