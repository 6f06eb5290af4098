package com.mcpbuilder.dispatch.api;

/**
 * Inbound JSON body for PUT /api/v1/projects/{id}. Null fields are left unchanged.
 */
public record UpdateProjectRequest(
    String name,
    String description
) {}
