package com.mcpbuilder.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * An error recorded while a project build runs.
 *
 * @param severity        how badly the build is affected
 * @param message         human-readable description
 * @param phase           build phase the error occurred in
 * @param timestamp       when it was recorded
 * @param recoveryActions suggested follow-ups (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorEntry(
    Severity severity,
    String message,
    String phase,
    Instant timestamp,
    List<String> recoveryActions
) {
    public enum Severity { LOW, MEDIUM, HIGH, CRITICAL }
}
