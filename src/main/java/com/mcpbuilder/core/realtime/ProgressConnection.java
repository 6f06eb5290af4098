package com.mcpbuilder.core.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One live client connection held by the {@link ConnectionRegistry}.
 * <p>
 * The subscription set is only touched by the registry while it holds its lock.
 * {@code lastActivity} is updated on every inbound frame and every successful send.
 */
public final class ProgressConnection {

    private static final Logger log = LoggerFactory.getLogger(ProgressConnection.class);

    private final String id;
    private final String userId;
    private final ConnectionTransport transport;
    private final Instant connectedAt;
    private final Set<String> subscriptions = new LinkedHashSet<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Instant lastActivity;

    ProgressConnection(String id, String userId, ConnectionTransport transport, Instant now) {
        this.id = id;
        this.userId = userId;
        this.transport = transport;
        this.connectedAt = now;
        this.lastActivity = now;
    }

    public String id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public boolean isOpen() {
        return transport.isOpen();
    }

    void touch(Instant now) {
        lastActivity = now;
    }

    Set<String> subscriptions() {
        return subscriptions;
    }

    List<String> subscriptionSnapshot() {
        return List.copyOf(subscriptions);
    }

    /**
     * Sends a pre-encoded frame. Failures are logged and reported as {@code false}; the
     * liveness monitor decides what happens to a connection that stops accepting frames.
     */
    boolean send(String payload, Instant now) {
        if (closed.get() || !transport.isOpen()) {
            return false;
        }
        try {
            transport.send(payload);
            lastActivity = now;
            return true;
        } catch (IOException | RuntimeException e) {
            log.debug("Send failed on connection {} (user {}): {}", id, userId, e.getMessage());
            return false;
        }
    }

    /**
     * Closes the transport the first time this is called, if it is still open.
     */
    void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!transport.isOpen()) {
            return;
        }
        try {
            transport.close();
        } catch (IOException e) {
            log.debug("Closing transport for connection {} failed: {}", id, e.getMessage());
        }
    }
}
