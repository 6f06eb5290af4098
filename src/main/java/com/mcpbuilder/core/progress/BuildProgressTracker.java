package com.mcpbuilder.core.progress;

import com.mcpbuilder.core.events.BuildEvent;
import com.mcpbuilder.core.events.EventBus;
import com.mcpbuilder.core.logging.MdcContext;
import com.mcpbuilder.core.model.ErrorEntry;
import com.mcpbuilder.core.model.ProgressUpdate;
import com.mcpbuilder.core.model.ProjectStatus;
import com.mcpbuilder.core.project.ProjectStore;
import com.mcpbuilder.core.realtime.BroadcastService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns build pipeline events into weighted overall progress and broadcasts it to the
 * project's subscribers.
 * <p>
 * Overall progress is the weight of completed phases plus the current phase's share,
 * over the total weight of all phases. The pipeline never needs to know who is listening.
 */
@Service
public class BuildProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(BuildProgressTracker.class);

    public static final String PHASE_COMPLETED = "completed";
    public static final String PHASE_FAILED = "failed";

    static final Map<String, Double> PHASE_WEIGHTS;
    static final Map<String, String> DISPLAY_NAMES;

    static {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("initialization", 5.0);
        weights.put("template_preparation", 10.0);
        weights.put("directory_creation", 5.0);
        weights.put("file_download", 20.0);
        weights.put("template_customization", 15.0);
        weights.put("dependency_installation", 25.0);
        weights.put("build_execution", 15.0);
        weights.put("validation", 5.0);
        PHASE_WEIGHTS = Map.copyOf(weights);

        Map<String, String> names = new LinkedHashMap<>();
        names.put("initialization", "Initializing Project");
        names.put("template_preparation", "Preparing Template");
        names.put("directory_creation", "Creating Directory Structure");
        names.put("file_download", "Downloading Template Files");
        names.put("template_customization", "Customizing Template");
        names.put("dependency_installation", "Installing Dependencies");
        names.put("build_execution", "Building Project");
        names.put("validation", "Validating Server");
        names.put(PHASE_COMPLETED, "Project Completed");
        names.put(PHASE_FAILED, "Project Failed");
        DISPLAY_NAMES = Map.copyOf(names);
    }

    private static final double TOTAL_WEIGHT =
            PHASE_WEIGHTS.values().stream().mapToDouble(Double::doubleValue).sum();

    private final EventBus eventBus;
    private final BroadcastService broadcastService;
    private final ProjectStore projectStore;
    private final Clock clock;

    private final ConcurrentHashMap<String, BuildState> states = new ConcurrentHashMap<>();
    private EventBus.Subscription subscription;

    @Autowired
    public BuildProgressTracker(EventBus eventBus, BroadcastService broadcastService, ProjectStore projectStore) {
        this(eventBus, broadcastService, projectStore, Clock.systemUTC());
    }

    BuildProgressTracker(EventBus eventBus, BroadcastService broadcastService,
                         ProjectStore projectStore, Clock clock) {
        this.eventBus = eventBus;
        this.broadcastService = broadcastService;
        this.projectStore = projectStore;
        this.clock = clock;
    }

    @PostConstruct
    void start() {
        subscription = eventBus.subscribeAll(this::onBuildEvent);
    }

    @PreDestroy
    void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    /**
     * Applies one build event and broadcasts the resulting progress.
     *
     * @return number of connections the update reached
     */
    public int onBuildEvent(BuildEvent event) {
        MdcContext.setProject(event.projectId());
        try {
            ProgressUpdate update;
            boolean started;
            BuildState state = states.computeIfAbsent(event.projectId(), id -> new BuildState(id, clock.instant()));
            synchronized (state) {
                started = state.updates == 0;
                state.apply(event, clock.instant());
                update = state.toUpdate(event);
            }

            if (started) {
                projectStore.updateStatus(event.projectId(), ProjectStatus.BUILDING);
            }
            if (PHASE_COMPLETED.equals(event.phase())) {
                finish(event.projectId(), ProjectStatus.COMPLETED);
            } else if (PHASE_FAILED.equals(event.phase())) {
                finish(event.projectId(), ProjectStatus.FAILED);
            }
            return broadcastService.broadcastToTopic(event.projectId(), update);
        } finally {
            MdcContext.clear();
        }
    }

    public Optional<ProgressUpdate> currentProgress(String projectId) {
        BuildState state = states.get(projectId);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.of(state.toUpdate(null));
        }
    }

    public int trackedBuilds() {
        return states.size();
    }

    private void finish(String projectId, ProjectStatus status) {
        states.remove(projectId);
        projectStore.updateStatus(projectId, status);
        log.info("Build of project {} finished: {}", projectId, status);
    }

    static double overallProgress(Set<String> completedPhases, String currentPhase, double phaseProgress) {
        double done = 0.0;
        for (String phase : completedPhases) {
            done += PHASE_WEIGHTS.getOrDefault(phase, 0.0);
        }
        if (currentPhase != null && !completedPhases.contains(currentPhase)) {
            done += PHASE_WEIGHTS.getOrDefault(currentPhase, 0.0) * (phaseProgress / 100.0);
        }
        return Math.min(100.0, done / TOTAL_WEIGHT * 100.0);
    }

    static String displayName(String phase) {
        if (phase == null || phase.isEmpty()) {
            return "";
        }
        String name = DISPLAY_NAMES.get(phase);
        if (name != null) {
            return name;
        }
        return Character.toUpperCase(phase.charAt(0)) + phase.substring(1).replace('_', ' ');
    }

    /** Mutable per-project state; guarded by its own monitor. */
    private static final class BuildState {

        private final String projectId;
        private final Instant startedAt;
        private Instant lastUpdate;
        private String currentPhase = "initialization";
        private double phaseProgress;
        private final Set<String> completedPhases = new LinkedHashSet<>();
        private final List<ErrorEntry> errors = new ArrayList<>();
        private int warnings;
        private int updates;

        BuildState(String projectId, Instant startedAt) {
            this.projectId = projectId;
            this.startedAt = startedAt;
            this.lastUpdate = startedAt;
        }

        void apply(BuildEvent event, Instant now) {
            updates++;
            lastUpdate = now;
            if (event.phase() == null) {
                return;
            }
            switch (event.type()) {
                case PHASE_START -> {
                    currentPhase = event.phase();
                    phaseProgress = 0.0;
                }
                case PHASE_PROGRESS -> {
                    currentPhase = event.phase();
                    phaseProgress = Math.max(0.0, Math.min(100.0, event.percentage()));
                }
                case PHASE_COMPLETE -> {
                    completedPhases.add(event.phase());
                    phaseProgress = 100.0;
                }
                case ERROR -> {
                    String message = event.error() != null ? event.error() : event.message();
                    errors.add(new ErrorEntry(ErrorEntry.Severity.HIGH, message, event.phase(),
                            event.timestamp() != null ? event.timestamp() : now, null));
                    log.error("Build error in project {} during {}: {}", event.projectId(), event.phase(), message);
                }
                case WARNING -> {
                    warnings++;
                    log.warn("Build warning in project {} during {}: {}", event.projectId(), event.phase(), event.message());
                }
                case INFO -> log.info("Build info for project {}: {}", event.projectId(), event.message());
            }
        }

        ProgressUpdate toUpdate(BuildEvent event) {
            String phase = event != null && event.phase() != null ? event.phase() : currentPhase;
            double overall = PHASE_COMPLETED.equals(phase)
                    ? 100.0
                    : overallProgress(completedPhases, currentPhase, phaseProgress);
            overall = Math.round(overall * 10.0) / 10.0;

            String message = event != null && event.message() != null ? event.message() : displayName(phase);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("displayName", displayName(phase));
            metadata.put("phaseProgress", phaseProgress);
            metadata.put("completedPhases", List.copyOf(completedPhases));
            metadata.put("warningCount", warnings);
            metadata.put("startedAt", startedAt);
            if (event != null) {
                metadata.put("eventType", event.type().name());
                if (!event.details().isEmpty()) {
                    metadata.put("details", event.details());
                }
            }

            return new ProgressUpdate(projectId, phase, overall, message,
                    lastUpdate, estimateRemaining(overall), errors.isEmpty() ? null : List.copyOf(errors), metadata);
        }

        private Long estimateRemaining(double overall) {
            if (overall <= 0.0 || overall >= 100.0) {
                return null;
            }
            double elapsed = Duration.between(startedAt, lastUpdate).toMillis() / 1000.0;
            double total = elapsed / (overall / 100.0);
            return Math.max(0L, Math.round(total - elapsed));
        }
    }
}
