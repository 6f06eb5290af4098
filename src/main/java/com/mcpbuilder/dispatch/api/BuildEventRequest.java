package com.mcpbuilder.dispatch.api;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/projects/{id}/events, sent by the build pipeline.
 *
 * @param type       PHASE_START, PHASE_PROGRESS, PHASE_COMPLETE, ERROR, WARNING or INFO
 * @param phase      build phase name
 * @param percentage progress within the phase, defaults to 0
 * @param message    human-readable status line; nullable
 * @param error      error text for ERROR events; nullable
 * @param details    extra key-value data; nullable
 */
public record BuildEventRequest(
    String type,
    String phase,
    Double percentage,
    String message,
    String error,
    Map<String, Object> details
) {}
