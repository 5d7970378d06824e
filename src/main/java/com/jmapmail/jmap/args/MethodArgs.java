package com.jmapmail.jmap.args;

import lombok.Data;

@Data
public class MethodArgs {

    private String accountId;
}
