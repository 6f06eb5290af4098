package com.mcpbuilder.core.model;

import java.util.Optional;

/**
 * Frame type tags exchanged over a progress connection.
 */
public enum FrameType {
    SUBSCRIBE("subscribe"),
    UNSUBSCRIBE("unsubscribe"),
    PROGRESS("progress"),
    ERROR("error"),
    PING("ping"),
    PONG("pong");

    private final String wireName;

    FrameType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<FrameType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (FrameType type : values()) {
            if (type.wireName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
