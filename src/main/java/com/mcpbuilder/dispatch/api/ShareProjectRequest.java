package com.mcpbuilder.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/projects/{id}/share.
 *
 * @param targetUserId user to share with
 * @param permission   READ, WRITE or ADMIN
 */
public record ShareProjectRequest(
    String targetUserId,
    String permission
) {}
