package com.mcpbuilder.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/projects.
 *
 * @param name        display name, required
 * @param description optional description
 * @param mode        QUICK or ADVANCED, defaults to QUICK
 */
public record CreateProjectRequest(
    String name,
    String description,
    String mode
) {}
