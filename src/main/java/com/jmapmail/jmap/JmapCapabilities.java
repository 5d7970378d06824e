package com.jmapmail.jmap;

import java.util.List;

public final class JmapCapabilities {

    public static final String CORE = "urn:ietf:params:jmap:core";
    public static final String MAIL = "urn:ietf:params:jmap:mail";
    public static final String SUBMISSION = "urn:ietf:params:jmap:submission";

    public static final List<String> SUPPORTED = List.of(CORE, MAIL, SUBMISSION);

    private JmapCapabilities() {}
}
