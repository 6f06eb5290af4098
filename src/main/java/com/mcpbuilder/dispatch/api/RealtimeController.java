package com.mcpbuilder.dispatch.api;

import com.mcpbuilder.core.model.Frame;
import com.mcpbuilder.core.model.ProgressUpdate;
import com.mcpbuilder.core.realtime.BroadcastService;
import com.mcpbuilder.core.realtime.ConnectionRegistry;
import com.mcpbuilder.core.realtime.ConnectionStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

/**
 * REST surface over the connection registry: broadcasts for the build pipeline and
 * read-only views for operators.
 */
@RestController
@RequestMapping("/api/v1/realtime")
public class RealtimeController {

    private static final Logger log = LoggerFactory.getLogger(RealtimeController.class);

    static final String USER_HEADER = "X-User-Id";

    private final BroadcastService broadcastService;
    private final ConnectionRegistry connectionRegistry;

    public RealtimeController(BroadcastService broadcastService, ConnectionRegistry connectionRegistry) {
        this.broadcastService = broadcastService;
        this.connectionRegistry = connectionRegistry;
    }

    /**
     * POST /api/v1/realtime/broadcast/progress: Push a progress update to a project's subscribers.
     */
    @PostMapping("/broadcast/progress")
    public ResponseEntity<Map<String, Object>> broadcastProgress(@RequestBody BroadcastProgressRequest request) {
        if (request.projectId() == null || request.projectId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Project ID is required"));
        }
        if (request.update() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Progress update is required"));
        }

        // The frame is always labelled with the topic it goes to.
        ProgressUpdate body = request.update();
        ProgressUpdate update = new ProgressUpdate(request.projectId(), body.phase(), body.percentage(),
                body.message(), body.timestamp() != null ? body.timestamp() : Instant.now(),
                body.estimatedTimeRemaining(), body.errors(), body.metadata());

        int sentCount = broadcastService.broadcastToTopic(request.projectId(), update, request.excludeUserId());
        log.debug("Broadcast for project {} reached {} connection(s)", request.projectId(), sentCount);
        return ResponseEntity.ok(Map.of("sentCount", sentCount));
    }

    /**
     * POST /api/v1/realtime/broadcast/user: Push an arbitrary frame to every connection of a user.
     */
    @PostMapping("/broadcast/user")
    public ResponseEntity<Map<String, Object>> broadcastToUser(
            @RequestHeader(value = USER_HEADER, required = false) String callerId,
            @RequestBody BroadcastToUserRequest request) {
        if (isBlank(callerId)) {
            return unauthenticated();
        }
        if (isBlank(request.targetUserId())) {
            return ResponseEntity.badRequest().body(Map.of("error", "Target user ID is required"));
        }
        if (request.message() == null || isBlank(request.message().type())) {
            return ResponseEntity.badRequest().body(Map.of("error", "Message type is required"));
        }

        Frame message = request.message();
        if (message.timestamp() == null) {
            message = new Frame(message.type(), message.data(), Instant.now());
        }
        int sentCount = broadcastService.sendToUser(request.targetUserId(), message);
        return ResponseEntity.ok(Map.of("sentCount", sentCount));
    }

    /**
     * GET /api/v1/realtime/stats: Connection counts for operators.
     */
    @GetMapping("/stats")
    public ResponseEntity<?> stats(@RequestHeader(value = USER_HEADER, required = false) String callerId) {
        if (isBlank(callerId)) {
            return unauthenticated();
        }
        ConnectionStats stats = connectionRegistry.stats();
        return ResponseEntity.ok(stats);
    }

    /**
     * GET /api/v1/realtime/projects/{projectId}/subscribers: Distinct users following a project.
     */
    @GetMapping("/projects/{projectId}/subscribers")
    public ResponseEntity<Map<String, Object>> projectSubscribers(
            @RequestHeader(value = USER_HEADER, required = false) String callerId,
            @PathVariable String projectId) {
        if (isBlank(callerId)) {
            return unauthenticated();
        }
        return ResponseEntity.ok(Map.of("subscribers", connectionRegistry.subscribersForTopic(projectId)));
    }

    /**
     * GET /api/v1/realtime/users/{userId}/connections: Connection ids held by a user.
     */
    @GetMapping("/users/{userId}/connections")
    public ResponseEntity<Map<String, Object>> userConnections(@PathVariable String userId) {
        return ResponseEntity.ok(Map.of("connections", connectionRegistry.connectionsForUser(userId)));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ResponseEntity<Map<String, Object>> unauthenticated() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Map.of("error", "User ID is required"));
    }
}
