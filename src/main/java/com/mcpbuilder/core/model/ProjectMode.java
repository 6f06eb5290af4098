package com.mcpbuilder.core.model;

public enum ProjectMode {
    QUICK,
    ADVANCED
}
