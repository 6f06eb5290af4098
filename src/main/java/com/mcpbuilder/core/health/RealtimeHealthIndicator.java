package com.mcpbuilder.core.health;

import com.mcpbuilder.core.realtime.ConnectionRegistry;
import com.mcpbuilder.core.realtime.ConnectionStats;
import com.mcpbuilder.core.realtime.LivenessMonitor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the realtime channel.
 * <p>
 * DOWN when the liveness monitor is not running; DEGRADED while closed connections
 * wait for the next cleanup run. Includes connection and topic counts.
 */
@Component("realtimeHealthIndicator")
public class RealtimeHealthIndicator implements HealthIndicator {

    private final ConnectionRegistry connectionRegistry;
    private final LivenessMonitor livenessMonitor;

    public RealtimeHealthIndicator(ConnectionRegistry connectionRegistry, LivenessMonitor livenessMonitor) {
        this.connectionRegistry = connectionRegistry;
        this.livenessMonitor = livenessMonitor;
    }

    @Override
    public Health health() {
        ConnectionStats stats = connectionRegistry.stats();
        var builder = livenessMonitor.isRunning() ? Health.up() : Health.down();
        builder.withDetail("totalConnections", stats.totalConnections())
                .withDetail("activeConnections", stats.activeConnections())
                .withDetail("topics", stats.subscriptionsByTopic().size());

        if (livenessMonitor.isRunning() && stats.activeConnections() < stats.totalConnections()) {
            return builder.status("DEGRADED").build();
        }
        return builder.build();
    }
}
