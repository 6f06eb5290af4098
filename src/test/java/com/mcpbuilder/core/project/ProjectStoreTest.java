package com.mcpbuilder.core.project;

import com.mcpbuilder.core.model.Permission;
import com.mcpbuilder.core.model.Project;
import com.mcpbuilder.core.model.ProjectMode;
import com.mcpbuilder.core.model.ProjectPage;
import com.mcpbuilder.core.model.ProjectStatus;
import com.mcpbuilder.core.model.ProjectSummary;
import com.mcpbuilder.core.realtime.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ProjectStore}.
 */
class ProjectStoreTest {

    private MutableClock clock;
    private ProjectStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new ProjectStore(clock);
    }

    private Project create(String owner, String name) {
        Project project = store.create(owner, name, null, null);
        clock.advance(Duration.ofSeconds(1));
        return project;
    }

    // -- Create and read ------------------------------------------------------

    @Nested
    @DisplayName("create and get")
    class CreateAndGetTests {

        @Test
        @DisplayName("creates a DRAFT QUICK project at version 1 owned by the caller")
        void createDefaults() {
            Project project = store.create("alice", "weather-server", "Forecasts", null);

            assertTrue(project.id().startsWith("proj_"));
            assertEquals("alice", project.ownerId());
            assertEquals(ProjectStatus.DRAFT, project.status());
            assertEquals(ProjectMode.QUICK, project.mode());
            assertEquals(1, project.version());
            assertEquals(clock.instant(), project.createdAt());
            assertNull(project.completedAt());
            assertTrue(project.permissions().isEmpty());
        }

        @Test
        @DisplayName("owner can read, strangers see nothing")
        void getChecksAccess() {
            Project project = create("alice", "weather-server");

            assertTrue(store.get(project.id(), "alice").isPresent());
            assertTrue(store.get(project.id(), "mallory").isEmpty());
            assertTrue(store.get("proj_missing", "alice").isEmpty());
        }
    }

    // -- Updates --------------------------------------------------------------

    @Nested
    @DisplayName("updates")
    class UpdateTests {

        @Test
        @DisplayName("owner can rename; null fields keep their value")
        void ownerRenames() {
            Project project = store.create("alice", "weather-server", "Forecasts", null);
            clock.advance(Duration.ofMinutes(1));

            Project updated = store.updateDetails(project.id(), "alice", "forecast-server", null).orElseThrow();

            assertEquals("forecast-server", updated.name());
            assertEquals("Forecasts", updated.description());
            assertEquals(clock.instant(), updated.updatedAt());
        }

        @Test
        @DisplayName("READ-shared user cannot rename, WRITE-shared user can")
        void writeNeedsWritePermission() {
            Project project = create("alice", "weather-server");
            store.share(project.id(), "alice", "bob", Permission.READ);
            store.share(project.id(), "alice", "carol", Permission.WRITE);

            assertTrue(store.updateDetails(project.id(), "bob", "x", null).isEmpty());
            assertTrue(store.updateDetails(project.id(), "carol", "y", null).isPresent());
            assertEquals("y", store.find(project.id()).orElseThrow().name());
        }

        @Test
        @DisplayName("user status change needs WRITE; system status change needs none")
        void statusChanges() {
            Project project = create("alice", "weather-server");

            assertTrue(store.updateStatus(project.id(), "bob", ProjectStatus.CANCELLED).isEmpty());
            assertEquals(ProjectStatus.CANCELLED,
                    store.updateStatus(project.id(), "alice", ProjectStatus.CANCELLED).orElseThrow().status());

            assertTrue(store.updateStatus(project.id(), ProjectStatus.COMPLETED));
            assertNotNull(store.find(project.id()).orElseThrow().completedAt());
            assertFalse(store.updateStatus("proj_missing", ProjectStatus.BUILDING));
        }
    }

    // -- Sharing and deletion -------------------------------------------------

    @Nested
    @DisplayName("sharing and deletion")
    class SharingTests {

        @Test
        @DisplayName("only ADMIN can share, unshare and delete")
        void adminOperations() {
            Project project = create("alice", "weather-server");
            store.share(project.id(), "alice", "bob", Permission.WRITE);

            assertTrue(store.share(project.id(), "bob", "mallory", Permission.READ).isEmpty());
            assertFalse(store.delete(project.id(), "bob"));

            store.share(project.id(), "alice", "bob", Permission.ADMIN);
            assertTrue(store.share(project.id(), "bob", "carol", Permission.READ).isPresent());
            assertTrue(store.unshare(project.id(), "bob", "carol").isPresent());
            assertFalse(store.find(project.id()).orElseThrow().isSharedWith("carol"));

            assertTrue(store.delete(project.id(), "bob"));
            assertTrue(store.find(project.id()).isEmpty());
            assertFalse(store.delete(project.id(), "alice"));
        }
    }

    // -- Listing --------------------------------------------------------------

    @Nested
    @DisplayName("list")
    class ListTests {

        @Test
        @DisplayName("lists own and shared projects, newest first")
        void listsOwnAndShared() {
            Project older = create("alice", "first");
            Project shared = create("bob", "bobs");
            Project newer = create("alice", "second");
            create("carol", "hidden");
            store.share(shared.id(), "bob", "alice", Permission.READ);

            ProjectPage page = store.list("alice", null, true, 0, 20);

            assertEquals(3, page.total());
            assertFalse(page.hasMore());
            assertEquals(List.of(shared.id(), newer.id(), older.id()),
                    page.projects().stream().map(ProjectSummary::id).toList());
            ProjectSummary sharedSummary = page.projects().get(0);
            assertTrue(sharedSummary.shared());
            assertFalse(sharedSummary.canEdit());
        }

        @Test
        @DisplayName("shared projects can be excluded and status filtered")
        void filters() {
            Project own = create("alice", "mine");
            Project shared = create("bob", "bobs");
            store.share(shared.id(), "bob", "alice", Permission.WRITE);
            store.updateStatus(own.id(), ProjectStatus.BUILDING);

            assertEquals(1, store.list("alice", null, false, 0, 20).total());
            ProjectPage building = store.list("alice", ProjectStatus.BUILDING, true, 0, 20);
            assertEquals(List.of(own.id()), building.projects().stream().map(ProjectSummary::id).toList());
        }

        @Test
        @DisplayName("pages through results")
        void paging() {
            for (int i = 0; i < 5; i++) {
                create("alice", "p" + i);
            }

            ProjectPage first = store.list("alice", null, true, 0, 2);
            ProjectPage last = store.list("alice", null, true, 4, 2);
            ProjectPage beyond = store.list("alice", null, true, 10, 2);

            assertEquals(2, first.projects().size());
            assertTrue(first.hasMore());
            assertEquals(1, last.projects().size());
            assertFalse(last.hasMore());
            assertTrue(beyond.projects().isEmpty());
            assertEquals(5, beyond.total());
        }
    }
}
