package com.mcpbuilder.core.realtime;

import com.mcpbuilder.core.metrics.RealtimeMetrics;
import com.mcpbuilder.core.model.Frame;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the registry free of dead connections with two independent schedules.
 * <p>
 * The heartbeat pings every open connection. A failed ping is not acted on here. The
 * slower cleanup run evicts connections whose transport is no longer open, and connections
 * with no activity for longer than the stale threshold, whatever their transport reports.
 * Both runs work on a snapshot of the registry and go through its lock for every removal.
 */
@Service
public class LivenessMonitor {

    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    private final ConnectionRegistry registry;
    private final FrameCodec codec;
    private final RealtimeProperties properties;
    private final RealtimeMetrics metrics;

    private ScheduledExecutorService heartbeatScheduler;
    private ScheduledExecutorService cleanupScheduler;

    public LivenessMonitor(ConnectionRegistry registry,
                           FrameCodec codec,
                           RealtimeProperties properties,
                           RealtimeMetrics metrics) {
        this.registry = registry;
        this.codec = codec;
        this.properties = properties;
        this.metrics = metrics;
    }

    @PostConstruct
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        long heartbeatMs = properties.getHeartbeatInterval().toMillis();
        long cleanupMs = properties.getCleanupInterval().toMillis();

        heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(daemon("ws-heartbeat"));
        cleanupScheduler = Executors.newSingleThreadScheduledExecutor(daemon("ws-cleanup"));
        heartbeatScheduler.scheduleAtFixedRate(this::heartbeatSafely, heartbeatMs, heartbeatMs, TimeUnit.MILLISECONDS);
        cleanupScheduler.scheduleAtFixedRate(this::cleanupSafely, cleanupMs, cleanupMs, TimeUnit.MILLISECONDS);

        log.info("Liveness monitor started (heartbeat={}, cleanup={}, staleThreshold={})",
                properties.getHeartbeatInterval(), properties.getCleanupInterval(),
                properties.getStaleThreshold());
    }

    @PreDestroy
    public synchronized void stop() {
        if (heartbeatScheduler == null) {
            return;
        }
        shutdown(heartbeatScheduler);
        shutdown(cleanupScheduler);
        heartbeatScheduler = null;
        cleanupScheduler = null;
        log.info("Liveness monitor stopped");
    }

    public synchronized boolean isRunning() {
        return heartbeatScheduler != null && !heartbeatScheduler.isShutdown();
    }

    /**
     * Pings every open connection once.
     *
     * @return number of connections whose transport accepted the ping
     */
    public int runHeartbeat() {
        List<ProgressConnection> connections = registry.snapshot();
        if (connections.isEmpty()) {
            return 0;
        }
        Instant now = registry.clock().instant();
        String ping = codec.encode(Frame.ping(now));

        int sent = 0;
        for (ProgressConnection connection : connections) {
            if (connection.isOpen() && connection.send(ping, now)) {
                sent++;
            }
        }
        log.debug("Heartbeat sent to {}/{} connections", sent, connections.size());
        return sent;
    }

    /**
     * Evicts closed and stale connections once.
     *
     * @return number of connections evicted
     */
    public int runCleanup() {
        Instant now = registry.clock().instant();
        Duration staleThreshold = properties.getStaleThreshold();

        int evicted = 0;
        for (ProgressConnection connection : registry.snapshot()) {
            String reason = null;
            if (!connection.isOpen()) {
                reason = "closed";
            } else if (Duration.between(connection.lastActivity(), now).compareTo(staleThreshold) > 0) {
                reason = "stale";
            }
            if (reason != null && registry.remove(connection.id(), "evicted")) {
                metrics.recordEviction(reason);
                log.info("Evicted connection {} for user {} ({})", connection.id(), connection.userId(), reason);
                evicted++;
            }
        }
        return evicted;
    }

    private void heartbeatSafely() {
        try {
            runHeartbeat();
        } catch (Exception e) {
            log.warn("Heartbeat run failed: {}", e.getMessage(), e);
        }
    }

    private void cleanupSafely() {
        try {
            runCleanup();
        } catch (Exception e) {
            log.warn("Cleanup run failed: {}", e.getMessage(), e);
        }
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    private static void shutdown(ScheduledExecutorService scheduler) {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
