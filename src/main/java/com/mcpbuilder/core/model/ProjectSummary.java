package com.mcpbuilder.core.model;

import java.time.Instant;

/**
 * Listing view of a {@link Project} as seen by one user.
 */
public record ProjectSummary(
    String id,
    String name,
    String description,
    ProjectStatus status,
    ProjectMode mode,
    Instant createdAt,
    Instant updatedAt,
    boolean shared,
    boolean canEdit
) {

    public static ProjectSummary of(Project project, String viewerId) {
        return new ProjectSummary(project.id(), project.name(), project.description(),
                project.status(), project.mode(), project.createdAt(), project.updatedAt(),
                !project.isOwnedBy(viewerId), project.grants(viewerId, Permission.WRITE));
    }
}
