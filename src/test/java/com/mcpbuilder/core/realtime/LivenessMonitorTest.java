package com.mcpbuilder.core.realtime;

import com.mcpbuilder.core.metrics.RealtimeMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link LivenessMonitor}. Runs are invoked directly against a
 * {@link MutableClock}; the schedules themselves are only started in the lifecycle tests.
 */
class LivenessMonitorTest {

    private static final InboundFrameHandler IGNORE = (connectionId, payload) -> {};

    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private ConnectionRegistry registry;
    private RealtimeProperties properties;
    private LivenessMonitor monitor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        var metrics = new RealtimeMetrics(meterRegistry);
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = new ConnectionRegistry(metrics, clock);
        properties = new RealtimeProperties();
        monitor = new LivenessMonitor(registry, FakeTransport.codec(), properties, metrics);
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
    }

    // -- Heartbeat ------------------------------------------------------------

    @Nested
    @DisplayName("runHeartbeat")
    class HeartbeatTests {

        @Test
        @DisplayName("pings every open connection")
        void pingsOpenConnections() throws Exception {
            var first = new FakeTransport();
            var second = new FakeTransport();
            registry.admit("alice", first, IGNORE);
            registry.admit("bob", second, IGNORE);

            assertEquals(2, monitor.runHeartbeat());

            assertEquals("ping", first.lastFrame().get("type").asText());
            assertEquals("ping", second.lastFrame().get("type").asText());
            assertEquals(first.sent, second.sent);
        }

        @Test
        @DisplayName("skips closed connections and never removes anything")
        void skipsClosedWithoutRemoving() {
            var open = new FakeTransport();
            var closed = new FakeTransport();
            var failing = new FakeTransport();
            registry.admit("alice", open, IGNORE);
            registry.admit("bob", closed, IGNORE);
            registry.admit("carol", failing, IGNORE);
            closed.open = false;
            failing.failSends = true;

            assertEquals(1, monitor.runHeartbeat());

            assertTrue(closed.sent.isEmpty());
            assertEquals(3, registry.size());
        }

        @Test
        @DisplayName("a delivered ping refreshes the connection's activity")
        void pingRefreshesActivity() {
            registry.admit("alice", new FakeTransport(), IGNORE);
            clock.advance(Duration.ofMinutes(4));

            monitor.runHeartbeat();

            assertEquals(clock.instant(), registry.snapshot().get(0).lastActivity());
        }
    }

    // -- Cleanup --------------------------------------------------------------

    @Nested
    @DisplayName("runCleanup")
    class CleanupTests {

        @Test
        @DisplayName("evicts connections whose transport is no longer open")
        void evictsClosed() {
            var closed = new FakeTransport();
            String id = registry.admit("alice", closed, IGNORE);
            registry.subscribe(id, "proj-1");
            closed.open = false;

            assertEquals(1, monitor.runCleanup());

            assertEquals(0, registry.size());
            assertTrue(registry.subscribersForTopic("proj-1").isEmpty());
            assertEquals(1.0, meterRegistry.get("mcpbuilder.realtime.evictions")
                    .tag("reason", "closed").counter().count());
        }

        @Test
        @DisplayName("evicts open connections idle for longer than the stale threshold")
        void evictsStale() {
            var quiet = new FakeTransport();
            var chatty = new FakeTransport();
            String quietId = registry.admit("alice", quiet, IGNORE);
            String chattyId = registry.admit("bob", chatty, IGNORE);

            clock.advance(Duration.ofMinutes(4));
            registry.touch(chattyId);
            clock.advance(Duration.ofMinutes(2));

            assertEquals(1, monitor.runCleanup());

            assertTrue(registry.ownerOf(quietId).isEmpty());
            assertTrue(registry.ownerOf(chattyId).isPresent());
            assertEquals(1, quiet.closeCalls.get());
            assertEquals(1.0, meterRegistry.get("mcpbuilder.realtime.evictions")
                    .tag("reason", "stale").counter().count());
        }

        @Test
        @DisplayName("a connection exactly at the threshold is kept")
        void thresholdIsExclusive() {
            registry.admit("alice", new FakeTransport(), IGNORE);
            clock.advance(properties.getStaleThreshold());

            assertEquals(0, monitor.runCleanup());
            assertEquals(1, registry.size());
        }

        @Test
        @DisplayName("a connection whose sends fail is evicted once it goes stale")
        void failingSendsGoStale() {
            var failing = new FakeTransport();
            failing.failSends = true;
            registry.admit("alice", failing, IGNORE);

            for (int i = 0; i < 11; i++) {
                clock.advance(Duration.ofSeconds(30));
                monitor.runHeartbeat();
            }

            assertEquals(1, monitor.runCleanup());
            assertEquals(0, registry.size());
        }

        @Test
        @DisplayName("nothing to evict returns zero")
        void nothingToEvict() {
            registry.admit("alice", new FakeTransport(), IGNORE);

            assertEquals(0, monitor.runCleanup());
        }
    }

    // -- Lifecycle ------------------------------------------------------------

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("start and stop toggle the running state")
        void startStop() {
            assertFalse(monitor.isRunning());

            monitor.start();
            assertTrue(monitor.isRunning());

            monitor.stop();
            assertFalse(monitor.isRunning());
        }

        @Test
        @DisplayName("scheduled cleanup evicts closed connections")
        void scheduledCleanupRuns() throws Exception {
            properties.setHeartbeatInterval(Duration.ofMillis(20));
            properties.setCleanupInterval(Duration.ofMillis(20));
            var closed = new FakeTransport();
            registry.admit("alice", closed, IGNORE);
            closed.open = false;

            monitor.start();

            long deadline = System.currentTimeMillis() + 5_000;
            while (registry.size() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(0, registry.size());
        }
    }
}
