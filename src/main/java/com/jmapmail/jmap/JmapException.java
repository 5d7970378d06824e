package com.jmapmail.jmap;

import lombok.Getter;

import java.util.List;

/**
 * Error raised by method handlers and engines; carries the JMAP error type
 */
@Getter
public class JmapException extends RuntimeException {

    private final JmapErrorType type;
    private final List<String> properties;

    public JmapException(JmapErrorType type, String description) {
        this(type, description, null);
    }

    public JmapException(JmapErrorType type, String description, List<String> properties) {
        super(description);
        this.type = type;
        this.properties = properties;
    }

    public static JmapException invalidArguments(String description) {
        return new JmapException(JmapErrorType.INVALID_ARGUMENTS, description);
    }

    public static JmapException invalidProperties(String description, String... properties) {
        return new JmapException(JmapErrorType.INVALID_PROPERTIES, description,
                properties.length == 0 ? null : List.of(properties));
    }

    public static JmapException notFound(String description) {
        return new JmapException(JmapErrorType.NOT_FOUND, description);
    }

    public SetError toSetError() {
        return new SetError(type, getMessage(), properties);
    }
}
