package com.mcpbuilder.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for progress connections and broadcasts.
 */
@Service
public class RealtimeMetrics {

    private final MeterRegistry registry;

    public RealtimeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void registerConnectionGauge(Supplier<Number> liveConnections) {
        Gauge.builder("mcpbuilder.realtime.connections", liveConnections)
                .description("Connections currently held by the registry")
                .register(registry);
    }

    public void recordConnectionAdmitted() {
        Counter.builder("mcpbuilder.realtime.connections.admitted")
                .register(registry)
                .increment();
    }

    /**
     * @param reason "closed", "error", "evicted" or "shutdown"
     */
    public void recordConnectionRemoved(String reason) {
        Counter.builder("mcpbuilder.realtime.connections.removed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param reason "closed" when the transport was no longer open, "stale" when it went quiet
     */
    public void recordEviction(String reason) {
        Counter.builder("mcpbuilder.realtime.evictions")
                .description("Connections evicted by the liveness monitor")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordDelivery(boolean sent) {
        Counter.builder("mcpbuilder.realtime.deliveries")
                .tag("outcome", sent ? "sent" : "failed")
                .register(registry)
                .increment();
    }

    public void recordProtocolError(String code) {
        Counter.builder("mcpbuilder.realtime.protocol_errors")
                .description("Inbound frames rejected with an error reply")
                .tag("code", code)
                .register(registry)
                .increment();
    }
}
