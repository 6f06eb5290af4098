package com.mcpbuilder.dispatch.ws;

import com.mcpbuilder.core.realtime.ConnectionTransport;
import com.mcpbuilder.core.realtime.RealtimeProperties;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link ConnectionTransport} over a Spring {@link WebSocketSession}.
 * <p>
 * Sends go through a {@link ConcurrentWebSocketSessionDecorator}: concurrent senders are
 * serialized in submission order, and a peer that stops reading trips the send-time or
 * buffer limit instead of blocking the caller. Tripping a limit closes the session as
 * not reliable, so the liveness monitor evicts the connection.
 */
public class WebSocketSessionTransport implements ConnectionTransport {

    private final WebSocketSession session;
    private volatile Listener listener;

    public WebSocketSessionTransport(WebSocketSession session, RealtimeProperties properties) {
        this.session = new ConcurrentWebSocketSessionDecorator(session,
                (int) properties.getSendTimeLimit().toMillis(),
                properties.getSendBufferSizeLimit());
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String payload) throws IOException {
        try {
            session.sendMessage(new TextMessage(payload));
        } catch (SessionLimitExceededException e) {
            // The decorator drops every later frame silently, so the session must not stay open.
            IOException failure = new IOException("Session " + session.getId() + " exceeded its send limits", e);
            try {
                session.close(CloseStatus.SESSION_NOT_RELIABLE);
            } catch (IOException closeError) {
                failure.addSuppressed(closeError);
            }
            throw failure;
        }
    }

    @Override
    public void close() throws IOException {
        session.close(CloseStatus.GOING_AWAY);
    }

    @Override
    public synchronized void listen(Listener listener) {
        if (this.listener != null) {
            throw new IllegalStateException("Transport for session " + session.getId() + " already has a listener");
        }
        this.listener = listener;
    }

    void deliverMessage(String payload) {
        Listener current = listener;
        if (current != null) {
            current.onMessage(payload);
        }
    }

    void deliverClose() {
        Listener current = listener;
        if (current != null) {
            current.onClose();
        }
    }

    void deliverError(Throwable error) {
        Listener current = listener;
        if (current != null) {
            current.onError(error);
        }
    }
}
