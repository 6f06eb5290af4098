package com.mcpbuilder.core.realtime;

import com.mcpbuilder.core.metrics.RealtimeMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Owns every live {@link ProgressConnection} and the two indices derived from them:
 * connections by user and connections by topic.
 * <p>
 * All three maps are mutated under one lock, so a connection is never visible in an index
 * without also being in the connection map, and removal unwinds all of them in one step.
 * Transport I/O never happens while the lock is held: senders work on snapshots.
 */
@Service
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Object lock = new Object();

    private final Map<String, ProgressConnection> connections = new HashMap<>();
    private final Map<String, Set<String>> byUser = new HashMap<>();
    private final Map<String, Set<String>> byTopic = new HashMap<>();

    private final RealtimeMetrics metrics;
    private final Clock clock;

    @Autowired
    public ConnectionRegistry(RealtimeMetrics metrics) {
        this(metrics, Clock.systemUTC());
    }

    ConnectionRegistry(RealtimeMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
        metrics.registerConnectionGauge(this::size);
    }

    /**
     * Registers a newly established connection and subscribes to its transport events.
     *
     * @param userId    caller identity that opened the connection
     * @param transport the connection's channel, exclusively owned from now on
     * @param inbound   receives every inbound frame for the connection
     * @return the generated connection id
     */
    public String admit(String userId, ConnectionTransport transport, InboundFrameHandler inbound) {
        String connectionId = "conn_" + UUID.randomUUID();
        var connection = new ProgressConnection(connectionId, userId, transport, clock.instant());

        synchronized (lock) {
            connections.put(connectionId, connection);
            byUser.computeIfAbsent(userId, k -> new LinkedHashSet<>()).add(connectionId);
        }

        transport.listen(new ConnectionTransport.Listener() {
            @Override
            public void onMessage(String payload) {
                inbound.onFrame(connectionId, payload);
            }

            @Override
            public void onClose() {
                remove(connectionId, "closed");
            }

            @Override
            public void onError(Throwable error) {
                log.warn("Transport error on connection {} (user {}): {}",
                        connectionId, userId, error.getMessage());
                remove(connectionId, "error");
            }
        });

        metrics.recordConnectionAdmitted();
        log.info("Connection {} admitted for user {}", connectionId, userId);
        return connectionId;
    }

    /**
     * Removes a connection from every index and closes its transport. Unknown ids are ignored.
     */
    public void remove(String connectionId) {
        remove(connectionId, "removed");
    }

    boolean remove(String connectionId, String reason) {
        ProgressConnection connection;
        synchronized (lock) {
            connection = connections.remove(connectionId);
            if (connection == null) {
                return false;
            }
            detach(byUser, connection.userId(), connectionId);
            for (String topicId : connection.subscriptions()) {
                detach(byTopic, topicId, connectionId);
            }
            connection.subscriptions().clear();
        }

        connection.close();
        metrics.recordConnectionRemoved(reason);
        log.info("Connection {} removed for user {} ({})", connectionId, connection.userId(), reason);
        return true;
    }

    /**
     * Adds a topic to a connection's subscriptions.
     *
     * @return false if the connection is no longer registered
     */
    public boolean subscribe(String connectionId, String topicId) {
        synchronized (lock) {
            ProgressConnection connection = connections.get(connectionId);
            if (connection == null) {
                return false;
            }
            connection.subscriptions().add(topicId);
            byTopic.computeIfAbsent(topicId, k -> new LinkedHashSet<>()).add(connectionId);
        }
        log.debug("Connection {} subscribed to {}", connectionId, topicId);
        return true;
    }

    /**
     * Drops a topic from a connection's subscriptions.
     *
     * @return false if the connection is no longer registered
     */
    public boolean unsubscribe(String connectionId, String topicId) {
        synchronized (lock) {
            ProgressConnection connection = connections.get(connectionId);
            if (connection == null) {
                return false;
            }
            connection.subscriptions().remove(topicId);
            detach(byTopic, topicId, connectionId);
        }
        log.debug("Connection {} unsubscribed from {}", connectionId, topicId);
        return true;
    }

    /**
     * Records inbound activity on a connection.
     */
    public void touch(String connectionId) {
        ProgressConnection connection = find(connectionId).orElse(null);
        if (connection != null) {
            connection.touch(clock.instant());
        }
    }

    /**
     * Sends a pre-encoded frame to one connection.
     *
     * @return true if the transport accepted it; false on failure or if the id is unknown
     */
    public boolean sendTo(String connectionId, String payload) {
        return find(connectionId)
                .map(connection -> connection.send(payload, clock.instant()))
                .orElse(false);
    }

    public Optional<String> ownerOf(String connectionId) {
        return find(connectionId).map(ProgressConnection::userId);
    }

    public List<String> subscriptionsOf(String connectionId) {
        synchronized (lock) {
            ProgressConnection connection = connections.get(connectionId);
            return connection != null ? connection.subscriptionSnapshot() : List.of();
        }
    }

    public List<String> connectionsForUser(String userId) {
        synchronized (lock) {
            Set<String> ids = byUser.get(userId);
            return ids != null ? List.copyOf(ids) : List.of();
        }
    }

    /**
     * Distinct owners of the connections subscribed to a topic, in subscription order.
     */
    public List<String> subscribersForTopic(String topicId) {
        synchronized (lock) {
            Set<String> ids = byTopic.get(topicId);
            if (ids == null) {
                return List.of();
            }
            Set<String> users = new LinkedHashSet<>();
            for (String id : ids) {
                ProgressConnection connection = connections.get(id);
                if (connection != null) {
                    users.add(connection.userId());
                }
            }
            return List.copyOf(users);
        }
    }

    public ConnectionStats stats() {
        List<ProgressConnection> all;
        Map<String, Integer> topicCounts = new LinkedHashMap<>();
        Map<String, Integer> userCounts = new LinkedHashMap<>();
        synchronized (lock) {
            all = new ArrayList<>(connections.values());
            byTopic.forEach((topicId, ids) -> topicCounts.put(topicId, ids.size()));
            byUser.forEach((userId, ids) -> userCounts.put(userId, ids.size()));
        }
        int active = 0;
        for (ProgressConnection connection : all) {
            if (connection.isOpen()) {
                active++;
            }
        }
        return new ConnectionStats(all.size(), active, topicCounts, userCounts);
    }

    public int size() {
        synchronized (lock) {
            return connections.size();
        }
    }

    /**
     * Closes and removes every connection.
     */
    @PreDestroy
    public void shutdown() {
        List<String> ids;
        synchronized (lock) {
            ids = new ArrayList<>(connections.keySet());
        }
        for (String id : ids) {
            remove(id, "shutdown");
        }
        log.info("Connection registry shut down ({} connections closed)", ids.size());
    }

    // -- Snapshots for the broadcaster and liveness monitor ------------------

    List<ProgressConnection> snapshot() {
        synchronized (lock) {
            return new ArrayList<>(connections.values());
        }
    }

    List<ProgressConnection> topicSnapshot(String topicId) {
        synchronized (lock) {
            return resolve(byTopic.get(topicId));
        }
    }

    List<ProgressConnection> userSnapshot(String userId) {
        synchronized (lock) {
            return resolve(byUser.get(userId));
        }
    }

    Clock clock() {
        return clock;
    }

    private Optional<ProgressConnection> find(String connectionId) {
        synchronized (lock) {
            return Optional.ofNullable(connections.get(connectionId));
        }
    }

    private List<ProgressConnection> resolve(Set<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<ProgressConnection> resolved = new ArrayList<>(ids.size());
        for (String id : ids) {
            ProgressConnection connection = connections.get(id);
            if (connection != null) {
                resolved.add(connection);
            }
        }
        return resolved;
    }

    private static void detach(Map<String, Set<String>> index, String key, String connectionId) {
        Set<String> ids = index.get(key);
        if (ids != null) {
            ids.remove(connectionId);
            if (ids.isEmpty()) {
                index.remove(key);
            }
        }
    }
}
