package com.mcpbuilder.core.health;

import com.mcpbuilder.core.project.ProjectStore;
import com.mcpbuilder.core.realtime.ConnectionRegistry;
import com.mcpbuilder.core.realtime.ConnectionStats;
import com.mcpbuilder.core.realtime.LivenessMonitor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final ConnectionRegistry connectionRegistry;
    private final LivenessMonitor livenessMonitor;
    private final ProjectStore projectStore;

    public HealthCheckService(ConnectionRegistry connectionRegistry,
                              LivenessMonitor livenessMonitor,
                              ProjectStore projectStore) {
        this.connectionRegistry = connectionRegistry;
        this.livenessMonitor = livenessMonitor;
        this.projectStore = projectStore;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkConnections());
        results.add(checkLiveness());
        results.add(checkProjects());
        return results;
    }

    private HealthStatus checkConnections() {
        ConnectionStats stats = connectionRegistry.stats();
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("totalConnections", String.valueOf(stats.totalConnections()));
        metadata.put("activeConnections", String.valueOf(stats.activeConnections()));
        metadata.put("topics", String.valueOf(stats.subscriptionsByTopic().size()));
        metadata.put("users", String.valueOf(stats.connectionsByUser().size()));

        if (stats.activeConnections() < stats.totalConnections()) {
            return new HealthStatus("connections", HealthStatus.Status.DEGRADED,
                    (stats.totalConnections() - stats.activeConnections()) + " connection(s) awaiting eviction",
                    metadata);
        }
        return new HealthStatus("connections", HealthStatus.Status.UP,
                stats.totalConnections() + " connection(s) registered", metadata);
    }

    private HealthStatus checkLiveness() {
        if (livenessMonitor.isRunning()) {
            return new HealthStatus("liveness", HealthStatus.Status.UP,
                    "Heartbeat and cleanup schedules running", Map.of());
        }
        return new HealthStatus("liveness", HealthStatus.Status.DOWN,
                "Liveness monitor is not running", Map.of());
    }

    private HealthStatus checkProjects() {
        return new HealthStatus("projects", HealthStatus.Status.UP,
                "In-memory project store available",
                Map.of("projects", String.valueOf(projectStore.size())));
    }
}
