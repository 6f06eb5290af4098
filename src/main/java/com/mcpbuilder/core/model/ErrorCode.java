package com.mcpbuilder.core.model;

/**
 * Codes carried by {@code error} frames sent back to a client.
 */
public enum ErrorCode {
    INVALID_MESSAGE("Invalid message format"),
    UNKNOWN_MESSAGE_TYPE("Unknown message type"),
    MISSING_PROJECT_ID("Project ID is required"),
    ACCESS_DENIED("Access to project denied");

    private final String defaultMessage;

    ErrorCode(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
