package com.mcpbuilder.dispatch.api;

import com.mcpbuilder.core.events.BuildEvent;
import com.mcpbuilder.core.events.EventBus;
import com.mcpbuilder.core.model.BuildEventType;
import com.mcpbuilder.core.model.Permission;
import com.mcpbuilder.core.model.Project;
import com.mcpbuilder.core.model.ProjectMode;
import com.mcpbuilder.core.model.ProjectPage;
import com.mcpbuilder.core.model.ProjectStatus;
import com.mcpbuilder.core.project.ProjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for saved projects. The caller is identified by the {@code X-User-Id} header.
 * Projects the caller cannot access are reported as 404.
 */
@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private static final Logger log = LoggerFactory.getLogger(ProjectController.class);

    private final ProjectStore projectStore;
    private final EventBus eventBus;

    public ProjectController(ProjectStore projectStore, EventBus eventBus) {
        this.projectStore = projectStore;
        this.eventBus = eventBus;
    }

    /**
     * POST /api/v1/projects: Create a draft project owned by the caller.
     */
    @PostMapping
    public ResponseEntity<?> create(@RequestHeader(value = RealtimeController.USER_HEADER, required = false) String userId,
                                    @RequestBody CreateProjectRequest request) {
        if (isBlank(userId)) {
            return missingUser();
        }
        if (isBlank(request.name())) {
            return ResponseEntity.badRequest().body(Map.of("error", "Project name is required"));
        }
        Optional<ProjectMode> mode = parse(ProjectMode.class, request.mode());
        if (request.mode() != null && mode.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid mode: " + request.mode()));
        }

        Project project = projectStore.create(userId, request.name(), request.description(), mode.orElse(null));
        return ResponseEntity.status(HttpStatus.CREATED).body(project);
    }

    /**
     * GET /api/v1/projects: Projects owned by or shared with the caller, newest first.
     */
    @GetMapping
    public ResponseEntity<?> list(@RequestHeader(value = RealtimeController.USER_HEADER, required = false) String userId,
                                  @RequestParam(required = false) String status,
                                  @RequestParam(defaultValue = "true") boolean includeShared,
                                  @RequestParam(defaultValue = "0") int offset,
                                  @RequestParam(defaultValue = "20") int limit) {
        if (isBlank(userId)) {
            return missingUser();
        }
        Optional<ProjectStatus> statusFilter = parse(ProjectStatus.class, status);
        if (status != null && statusFilter.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid status: " + status));
        }
        ProjectPage page = projectStore.list(userId, statusFilter.orElse(null), includeShared, offset, limit);
        return ResponseEntity.ok(page);
    }

    /**
     * GET /api/v1/projects/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> get(@RequestHeader(value = RealtimeController.USER_HEADER, required = false) String userId,
                                 @PathVariable String id) {
        if (isBlank(userId)) {
            return missingUser();
        }
        return projectStore.get(id, userId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * PUT /api/v1/projects/{id}: Rename or re-describe a project. Needs WRITE.
     */
    @PutMapping("/{id}")
    public ResponseEntity<?> update(@RequestHeader(value = RealtimeController.USER_HEADER, required = false) String userId,
                                    @PathVariable String id,
                                    @RequestBody UpdateProjectRequest request) {
        if (isBlank(userId)) {
            return missingUser();
        }
        if (request.name() != null && request.name().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Project name must not be blank"));
        }
        return projectStore.updateDetails(id, userId, request.name(), request.description())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * DELETE /api/v1/projects/{id}: Needs ADMIN.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@RequestHeader(value = RealtimeController.USER_HEADER, required = false) String userId,
                                    @PathVariable String id) {
        if (isBlank(userId)) {
            return missingUser();
        }
        return projectStore.delete(id, userId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    /**
     * PUT /api/v1/projects/{id}/status: Set the project status, e.g. to cancel it. Needs WRITE.
     */
    @PutMapping("/{id}/status")
    public ResponseEntity<?> updateStatus(@RequestHeader(value = RealtimeController.USER_HEADER, required = false) String userId,
                                          @PathVariable String id,
                                          @RequestBody UpdateStatusRequest request) {
        if (isBlank(userId)) {
            return missingUser();
        }
        Optional<ProjectStatus> status = parse(ProjectStatus.class, request.status());
        if (status.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid status: " + request.status()));
        }
        return projectStore.updateStatus(id, userId, status.get())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/projects/{id}/share: Grant another user access. Needs ADMIN.
     */
    @PostMapping("/{id}/share")
    public ResponseEntity<?> share(@RequestHeader(value = RealtimeController.USER_HEADER, required = false) String userId,
                                   @PathVariable String id,
                                   @RequestBody ShareProjectRequest request) {
        if (isBlank(userId)) {
            return missingUser();
        }
        if (isBlank(request.targetUserId())) {
            return ResponseEntity.badRequest().body(Map.of("error", "Target user ID is required"));
        }
        Optional<Permission> permission = parse(Permission.class, request.permission());
        if (permission.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid permission: " + request.permission()));
        }
        return projectStore.share(id, userId, request.targetUserId(), permission.get())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * DELETE /api/v1/projects/{id}/share/{targetUserId}: Revoke access. Needs ADMIN.
     */
    @DeleteMapping("/{id}/share/{targetUserId}")
    public ResponseEntity<?> unshare(@RequestHeader(value = RealtimeController.USER_HEADER, required = false) String userId,
                                     @PathVariable String id,
                                     @PathVariable String targetUserId) {
        if (isBlank(userId)) {
            return missingUser();
        }
        return projectStore.unshare(id, userId, targetUserId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/projects/{id}/events: Build pipeline reports progress for a project.
     * The event is published on the bus and fanned out to the project's subscribers.
     */
    @PostMapping("/{id}/events")
    public ResponseEntity<Map<String, Object>> publishBuildEvent(@PathVariable String id,
                                                                 @RequestBody BuildEventRequest request) {
        Optional<BuildEventType> type = parse(BuildEventType.class, request.type());
        if (type.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid event type: " + request.type()));
        }
        if (isBlank(request.phase())) {
            return ResponseEntity.badRequest().body(Map.of("error", "Phase is required"));
        }

        var event = new BuildEvent(type.get(), id, request.phase(),
                request.percentage() != null ? request.percentage() : 0.0,
                request.message(), request.error(), request.details(), Instant.now());
        eventBus.publish(event);
        log.debug("Accepted {} ({}) for project {}", event.type(), event.phase(), id);
        return ResponseEntity.accepted().body(Map.of("projectId", id, "type", event.type().name()));
    }

    private static <E extends Enum<E>> Optional<E> parse(Class<E> type, String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static ResponseEntity<Map<String, Object>> missingUser() {
        return ResponseEntity.badRequest().body(Map.of("error", "X-User-Id header is required"));
    }
}
