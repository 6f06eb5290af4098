package com.mcpbuilder.core.progress;

import com.mcpbuilder.core.events.BuildEvent;
import com.mcpbuilder.core.events.EventBus;
import com.mcpbuilder.core.model.BuildEventType;
import com.mcpbuilder.core.model.ErrorEntry;
import com.mcpbuilder.core.model.Project;
import com.mcpbuilder.core.model.ProgressUpdate;
import com.mcpbuilder.core.model.ProjectMode;
import com.mcpbuilder.core.model.ProjectStatus;
import com.mcpbuilder.core.project.ProjectStore;
import com.mcpbuilder.core.realtime.BroadcastService;
import com.mcpbuilder.core.realtime.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link BuildProgressTracker}.
 */
class BuildProgressTrackerTest {

    private EventBus eventBus;
    private BroadcastService broadcastService;
    private ProjectStore projectStore;
    private MutableClock clock;
    private BuildProgressTracker tracker;
    private String projectId;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        broadcastService = mock(BroadcastService.class);
        when(broadcastService.broadcastToTopic(anyString(), any(ProgressUpdate.class))).thenReturn(1);
        projectStore = new ProjectStore();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        tracker = new BuildProgressTracker(eventBus, broadcastService, projectStore, clock);
        projectId = projectStore.create("alice", "weather-server", null, ProjectMode.QUICK).id();
    }

    @AfterEach
    void tearDown() {
        tracker.stop();
    }

    private BuildEvent event(BuildEventType type, String phase, double percentage) {
        return new BuildEvent(type, projectId, phase, percentage, null, null, null, clock.instant());
    }

    private ProgressUpdate lastBroadcast() {
        ArgumentCaptor<ProgressUpdate> captor = ArgumentCaptor.forClass(ProgressUpdate.class);
        verify(broadcastService, atLeastOnce()).broadcastToTopic(eq(projectId), captor.capture());
        return captor.getValue();
    }

    // -- Weighted progress ----------------------------------------------------

    @Nested
    @DisplayName("overall progress")
    class OverallProgressTests {

        @Test
        @DisplayName("phase start with nothing completed is 0%")
        void startIsZero() {
            tracker.onBuildEvent(event(BuildEventType.PHASE_START, "initialization", 0));

            ProgressUpdate update = lastBroadcast();
            assertEquals(0.0, update.percentage());
            assertEquals("initialization", update.phase());
            assertEquals("Initializing Project", update.message());
            assertNull(update.estimatedTimeRemaining());
        }

        @Test
        @DisplayName("completed phases contribute their full weight")
        void completedPhaseWeight() {
            tracker.onBuildEvent(event(BuildEventType.PHASE_START, "initialization", 0));
            tracker.onBuildEvent(event(BuildEventType.PHASE_COMPLETE, "initialization", 100));

            assertEquals(5.0, lastBroadcast().percentage());
        }

        @Test
        @DisplayName("current phase contributes its weight scaled by phase progress")
        void partialPhaseWeight() {
            tracker.onBuildEvent(event(BuildEventType.PHASE_COMPLETE, "initialization", 100));
            tracker.onBuildEvent(event(BuildEventType.PHASE_COMPLETE, "template_preparation", 100));
            tracker.onBuildEvent(event(BuildEventType.PHASE_COMPLETE, "directory_creation", 100));
            clock.advance(Duration.ofSeconds(30));
            tracker.onBuildEvent(event(BuildEventType.PHASE_PROGRESS, "file_download", 50));

            ProgressUpdate update = lastBroadcast();
            assertEquals(30.0, update.percentage());
            assertEquals(70L, update.estimatedTimeRemaining());
            assertEquals(50.0, update.metadata().get("phaseProgress"));
            assertEquals(List.of("initialization", "template_preparation", "directory_creation"),
                    update.metadata().get("completedPhases"));
        }

        @Test
        @DisplayName("phase progress is clamped to 0-100")
        void phaseProgressClamped() {
            tracker.onBuildEvent(event(BuildEventType.PHASE_PROGRESS, "dependency_installation", 250));

            assertEquals(25.0, lastBroadcast().percentage());
        }

        @Test
        @DisplayName("all phases completed is 100%")
        void allPhasesComplete() {
            assertEquals(100.0, BuildProgressTracker.overallProgress(
                    BuildProgressTracker.PHASE_WEIGHTS.keySet(), null, 0));
            assertEquals(0.0, BuildProgressTracker.overallProgress(Set.of(), "unknown_phase", 100));
        }
    }

    // -- Terminal phases ------------------------------------------------------

    @Nested
    @DisplayName("completion and failure")
    class TerminalPhaseTests {

        @Test
        @DisplayName("first event moves the project to BUILDING")
        void firstEventMarksBuilding() {
            tracker.onBuildEvent(event(BuildEventType.PHASE_START, "initialization", 0));

            assertEquals(ProjectStatus.BUILDING, projectStore.find(projectId).map(Project::status).orElseThrow());
            assertEquals(1, tracker.trackedBuilds());
        }

        @Test
        @DisplayName("completed phase reports 100%, completes the project and clears its state")
        void completed() {
            tracker.onBuildEvent(event(BuildEventType.PHASE_START, "initialization", 0));
            tracker.onBuildEvent(event(BuildEventType.PHASE_COMPLETE, BuildProgressTracker.PHASE_COMPLETED, 100));

            ProgressUpdate update = lastBroadcast();
            assertEquals(100.0, update.percentage());
            assertEquals("Project Completed", update.message());
            assertNull(update.estimatedTimeRemaining());

            Project project = projectStore.find(projectId).orElseThrow();
            assertEquals(ProjectStatus.COMPLETED, project.status());
            assertNotNull(project.completedAt());
            assertEquals(0, tracker.trackedBuilds());
            assertTrue(tracker.currentProgress(projectId).isEmpty());
        }

        @Test
        @DisplayName("failed phase marks the project FAILED and keeps the errors in the update")
        void failed() {
            tracker.onBuildEvent(event(BuildEventType.PHASE_START, "dependency_installation", 0));
            tracker.onBuildEvent(new BuildEvent(BuildEventType.ERROR, projectId, "dependency_installation", 0,
                    "npm install failed", "ERESOLVE unable to resolve dependency tree", null, clock.instant()));
            tracker.onBuildEvent(event(BuildEventType.PHASE_START, BuildProgressTracker.PHASE_FAILED, 0));

            ProgressUpdate update = lastBroadcast();
            assertEquals("Project Failed", update.message());
            assertEquals(1, update.errors().size());
            ErrorEntry error = update.errors().get(0);
            assertEquals(ErrorEntry.Severity.HIGH, error.severity());
            assertEquals("ERESOLVE unable to resolve dependency tree", error.message());
            assertEquals("dependency_installation", error.phase());

            assertEquals(ProjectStatus.FAILED, projectStore.find(projectId).map(Project::status).orElseThrow());
            assertEquals(0, tracker.trackedBuilds());
        }

        @Test
        @DisplayName("events for a project the store does not know are still broadcast")
        void unknownProjectStillBroadcast() {
            var event = new BuildEvent(BuildEventType.PHASE_START, "external-1", "initialization", 0,
                    "Starting", null, Map.of("runner", "ci"), clock.instant());

            assertEquals(1, tracker.onBuildEvent(event));

            ArgumentCaptor<ProgressUpdate> captor = ArgumentCaptor.forClass(ProgressUpdate.class);
            verify(broadcastService).broadcastToTopic(eq("external-1"), captor.capture());
            assertEquals("Starting", captor.getValue().message());
            assertEquals(Map.of("runner", "ci"), captor.getValue().metadata().get("details"));
        }
    }

    // -- Wiring ---------------------------------------------------------------

    @Nested
    @DisplayName("event bus wiring")
    class WiringTests {

        @Test
        @DisplayName("events published on the bus are tracked once started")
        void tracksPublishedEvents() {
            tracker.start();

            eventBus.publish(event(BuildEventType.PHASE_PROGRESS, "template_customization", 40));

            ProgressUpdate current = tracker.currentProgress(projectId).orElseThrow();
            assertEquals(projectId, current.projectId());
            assertEquals("template_customization", current.phase());
            verify(broadcastService).broadcastToTopic(eq(projectId), any(ProgressUpdate.class));
        }

        @Test
        @DisplayName("stopping unsubscribes from the bus")
        void stopUnsubscribes() {
            tracker.start();
            tracker.stop();

            eventBus.publish(event(BuildEventType.PHASE_START, "initialization", 0));

            verifyNoInteractions(broadcastService);
        }
    }

    @Test
    @DisplayName("display names fall back to a readable form of the phase id")
    void displayNames() {
        assertEquals("Downloading Template Files", BuildProgressTracker.displayName("file_download"));
        assertEquals("Custom step", BuildProgressTracker.displayName("custom_step"));
        assertEquals("", BuildProgressTracker.displayName(null));
    }
}
