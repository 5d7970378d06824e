package com.jmapmail.jmap;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * JMAP error vocabulary (method-level and per-object SetError types)
 */
public enum JmapErrorType {

    UNKNOWN_CAPABILITY("unknownCapability"),
    NOT_JSON("notJSON"),
    NOT_REQUEST("notRequest"),
    LIMIT("limit"),
    UNKNOWN_METHOD("unknownMethod"),
    ACCOUNT_NOT_FOUND("accountNotFound"),
    STATE_MISMATCH("stateMismatch"),
    INVALID_ARGUMENTS("invalidArguments"),
    INVALID_RESULT_REFERENCE("invalidResultReference"),
    INVALID_PROPERTIES("invalidProperties"),
    NOT_FOUND("notFound"),
    FORBIDDEN("forbidden"),
    LIMIT_EXCEEDED("limitExceeded"),
    TOO_LARGE("tooLarge"),
    ROLE_CONFLICT("roleConflict"),
    MAILBOX_HAS_CHILD("mailboxHasChild"),
    MAILBOX_HAS_EMAIL("mailboxHasEmail"),
    CANNOT_CALCULATE_CHANGES("cannotCalculateChanges"),
    CANNOT_UNSEND("cannotUnsend"),
    BLOB_NOT_FOUND("blobNotFound"),
    SERVER_ERROR("serverError");

    private final String value;

    JmapErrorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
