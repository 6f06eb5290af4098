package com.mcpbuilder.core.model;

public enum BuildEventType {
    PHASE_START,
    PHASE_PROGRESS,
    PHASE_COMPLETE,
    ERROR,
    WARNING,
    INFO
}
