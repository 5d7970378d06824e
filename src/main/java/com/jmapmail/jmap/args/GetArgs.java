package com.jmapmail.jmap.args;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;

/**
 * Foo/get arguments; null ids means all objects
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class GetArgs extends MethodArgs {

    private List<String> ids;
    private List<String> properties;
}
