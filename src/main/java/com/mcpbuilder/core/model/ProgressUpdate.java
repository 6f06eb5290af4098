package com.mcpbuilder.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Build progress for one project, pushed to every connection subscribed to it.
 *
 * @param projectId              the project (topic) being built
 * @param phase                  current build phase name
 * @param percentage             overall completion, 0-100
 * @param message                human-readable status line
 * @param timestamp              when the update was produced
 * @param estimatedTimeRemaining seconds left, if known (nullable)
 * @param errors                 errors accumulated so far (nullable)
 * @param metadata               extra key-value detail (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressUpdate(
    String projectId,
    String phase,
    double percentage,
    String message,
    Instant timestamp,
    Long estimatedTimeRemaining,
    List<ErrorEntry> errors,
    Map<String, Object> metadata
) {

    public static ProgressUpdate of(String projectId, String phase, double percentage,
                                    String message, Instant timestamp) {
        return new ProgressUpdate(projectId, phase, percentage, message, timestamp, null, null, null);
    }
}
