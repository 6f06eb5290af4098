package com.mcpbuilder.core.project;

import com.mcpbuilder.core.model.Permission;
import com.mcpbuilder.core.model.Project;
import com.mcpbuilder.core.model.ProjectMode;
import com.mcpbuilder.core.model.ProjectPage;
import com.mcpbuilder.core.model.ProjectStatus;
import com.mcpbuilder.core.model.ProjectSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Volatile in-memory store of saved projects, with owner and shared-permission checks.
 * <p>
 * Lookups that fail the access check behave exactly like lookups of a missing project.
 */
@Service
public class ProjectStore {

    private static final Logger log = LoggerFactory.getLogger(ProjectStore.class);

    private final ConcurrentHashMap<String, Project> projects = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public ProjectStore() {
        this(Clock.systemUTC());
    }

    ProjectStore(Clock clock) {
        this.clock = clock;
    }

    public Project create(String ownerId, String name, String description, ProjectMode mode) {
        Instant now = clock.instant();
        var project = new Project("proj_" + UUID.randomUUID(), name, description, ownerId,
                ProjectStatus.DRAFT, mode != null ? mode : ProjectMode.QUICK,
                now, now, null, Map.of(), 1);
        projects.put(project.id(), project);
        log.info("Created project {} for user {}", project.id(), ownerId);
        return project;
    }

    public Optional<Project> get(String projectId, String userId) {
        return find(projectId).filter(p -> p.grants(userId, Permission.READ));
    }

    public Optional<Project> find(String projectId) {
        return Optional.ofNullable(projects.get(projectId));
    }

    public Optional<Project> updateDetails(String projectId, String userId, String name, String description) {
        return modify(projectId, userId, Permission.WRITE, p -> p.withDetails(name, description, clock.instant()));
    }

    public boolean delete(String projectId, String userId) {
        AtomicBoolean deleted = new AtomicBoolean();
        projects.computeIfPresent(projectId, (id, project) -> {
            if (!project.grants(userId, Permission.ADMIN)) {
                return project;
            }
            deleted.set(true);
            return null;
        });
        if (deleted.get()) {
            log.info("Deleted project {} (by {})", projectId, userId);
        }
        return deleted.get();
    }

    public Optional<Project> share(String projectId, String userId, String targetUserId, Permission permission) {
        return modify(projectId, userId, Permission.ADMIN,
                p -> p.withPermission(targetUserId, permission, clock.instant()));
    }

    public Optional<Project> unshare(String projectId, String userId, String targetUserId) {
        return modify(projectId, userId, Permission.ADMIN,
                p -> p.withPermission(targetUserId, null, clock.instant()));
    }

    /**
     * Moves a project to a new status on behalf of a user. Needs WRITE.
     */
    public Optional<Project> updateStatus(String projectId, String userId, ProjectStatus status) {
        return modify(projectId, userId, Permission.WRITE, p -> p.withStatus(status, clock.instant()));
    }

    /**
     * Moves a project to a new status on behalf of the build pipeline. No access check.
     *
     * @return false if the project is unknown
     */
    public boolean updateStatus(String projectId, ProjectStatus status) {
        Project updated = projects.computeIfPresent(projectId, (id, p) -> p.withStatus(status, clock.instant()));
        if (updated != null) {
            log.debug("Project {} is now {}", projectId, status);
        }
        return updated != null;
    }

    /**
     * Projects the user owns, plus those shared with them when {@code includeShared},
     * most recently updated first.
     */
    public ProjectPage list(String userId, ProjectStatus status, boolean includeShared, int offset, int limit) {
        List<Project> visible = projects.values().stream()
                .filter(p -> p.isOwnedBy(userId) || (includeShared && p.isSharedWith(userId)))
                .filter(p -> status == null || p.status() == status)
                .sorted(Comparator.comparing(Project::updatedAt).reversed())
                .toList();

        int from = Math.min(Math.max(offset, 0), visible.size());
        int to = Math.min(from + Math.max(limit, 0), visible.size());
        List<ProjectSummary> page = visible.subList(from, to).stream()
                .map(p -> ProjectSummary.of(p, userId))
                .toList();
        return new ProjectPage(page, visible.size(), to < visible.size());
    }

    public int size() {
        return projects.size();
    }

    private Optional<Project> modify(String projectId, String userId, Permission required,
                                     UnaryOperator<Project> change) {
        AtomicBoolean allowed = new AtomicBoolean();
        Project result = projects.computeIfPresent(projectId, (id, project) -> {
            if (!project.grants(userId, required)) {
                return project;
            }
            allowed.set(true);
            return change.apply(project);
        });
        return allowed.get() ? Optional.ofNullable(result) : Optional.empty();
    }
}
