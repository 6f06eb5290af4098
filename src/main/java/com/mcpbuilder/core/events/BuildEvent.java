package com.mcpbuilder.core.events;

import com.mcpbuilder.core.model.BuildEventType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event emitted by the build pipeline while a project is generated.
 *
 * @param type       what happened
 * @param projectId  the project being built
 * @param phase      build phase name (e.g. "file_download", "completed", "failed")
 * @param percentage progress within the phase, 0-100
 * @param message    human-readable status line (nullable)
 * @param error      error text for {@link BuildEventType#ERROR} events (nullable)
 * @param details    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record BuildEvent(
    BuildEventType type,
    String projectId,
    String phase,
    double percentage,
    String message,
    String error,
    Map<String, Object> details,
    Instant timestamp
) {

    public BuildEvent {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }
}
