package com.jmapmail.domain;

/**
 * Object types with their own state string
 */
public enum JmapType {

    MAILBOX("Mailbox"),
    EMAIL("Email"),
    THREAD("Thread"),
    EMAIL_SUBMISSION("EmailSubmission");

    private final String jmapName;

    JmapType(String jmapName) {
        this.jmapName = jmapName;
    }

    public String getJmapName() {
        return jmapName;
    }
}
