package com.mcpbuilder.core.model;

import java.util.List;

public record ProjectPage(
    List<ProjectSummary> projects,
    int total,
    boolean hasMore
) {}
