package com.mcpbuilder.core.model;

public enum ProjectStatus {
    DRAFT,
    BUILDING,
    COMPLETED,
    FAILED,
    CANCELLED
}
