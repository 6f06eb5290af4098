package com.mcpbuilder.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A saved project. Instances are immutable; the store swaps in modified copies.
 *
 * @param id          unique project id ({@code proj_...})
 * @param name        display name
 * @param description optional description (nullable)
 * @param ownerId     user that created the project
 * @param status      lifecycle status
 * @param mode        quick or advanced generation mode
 * @param createdAt   creation time
 * @param updatedAt   last modification time
 * @param completedAt when the last build completed (nullable)
 * @param permissions users the project is shared with, and their access level
 * @param version     current configuration version, starting at 1
 */
public record Project(
    String id,
    String name,
    String description,
    String ownerId,
    ProjectStatus status,
    ProjectMode mode,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt,
    Map<String, Permission> permissions,
    int version
) {

    public Project {
        permissions = Map.copyOf(permissions);
    }

    public boolean isOwnedBy(String userId) {
        return ownerId.equals(userId);
    }

    /**
     * Owner has full access; everyone else needs a shared permission covering {@code required}.
     */
    public boolean grants(String userId, Permission required) {
        if (isOwnedBy(userId)) {
            return true;
        }
        Permission granted = permissions.get(userId);
        return granted != null && granted.covers(required);
    }

    public boolean isSharedWith(String userId) {
        return permissions.containsKey(userId);
    }

    public Project withDetails(String newName, String newDescription, Instant now) {
        return new Project(id, newName != null ? newName : name,
                newDescription != null ? newDescription : description,
                ownerId, status, mode, createdAt, now, completedAt, permissions, version);
    }

    public Project withStatus(ProjectStatus newStatus, Instant now) {
        Instant completed = newStatus == ProjectStatus.COMPLETED ? now : completedAt;
        return new Project(id, name, description, ownerId, newStatus, mode,
                createdAt, now, completed, permissions, version);
    }

    public Project withPermission(String userId, Permission permission, Instant now) {
        Map<String, Permission> shared = new LinkedHashMap<>(permissions);
        if (permission == null) {
            shared.remove(userId);
        } else {
            shared.put(userId, permission);
        }
        return new Project(id, name, description, ownerId, status, mode,
                createdAt, now, completedAt, shared, version);
    }
}
