package com.mcpbuilder.dispatch.ws;

import com.mcpbuilder.core.realtime.ConnectionRegistry;
import com.mcpbuilder.core.realtime.MessageDispatcher;
import com.mcpbuilder.core.realtime.RealtimeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Bridges Spring WebSocket sessions to the {@link ConnectionRegistry}.
 * <p>
 * Each session is admitted once it is established; its transport is kept in the session
 * attributes and receives the framework's message, error and close callbacks.
 */
@Component
public class ProgressWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ProgressWebSocketHandler.class);

    static final String TRANSPORT_ATTRIBUTE = "mcpbuilder.transport";
    static final String CONNECTION_ID_ATTRIBUTE = "mcpbuilder.connectionId";

    private final ConnectionRegistry registry;
    private final MessageDispatcher dispatcher;
    private final RealtimeProperties properties;

    public ProgressWebSocketHandler(ConnectionRegistry registry,
                                    MessageDispatcher dispatcher,
                                    RealtimeProperties properties) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        Object userId = session.getAttributes().get(CallerIdentityHandshakeInterceptor.USER_ID_ATTRIBUTE);
        if (!(userId instanceof String user) || user.isBlank()) {
            log.warn("Closing session {} established without a user id", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("User ID is required"));
            return;
        }

        var transport = new WebSocketSessionTransport(session, properties);
        session.getAttributes().put(TRANSPORT_ATTRIBUTE, transport);
        String connectionId = registry.admit(user, transport, dispatcher);
        session.getAttributes().put(CONNECTION_ID_ATTRIBUTE, connectionId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketSessionTransport transport = transportOf(session);
        if (transport != null) {
            transport.deliverMessage(message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        WebSocketSessionTransport transport = transportOf(session);
        if (transport != null) {
            transport.deliverError(exception);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("Session {} closed: {}", session.getId(), status);
        WebSocketSessionTransport transport = transportOf(session);
        if (transport != null) {
            transport.deliverClose();
        }
    }

    private static WebSocketSessionTransport transportOf(WebSocketSession session) {
        return session.getAttributes().get(TRANSPORT_ATTRIBUTE) instanceof WebSocketSessionTransport transport
                ? transport
                : null;
    }
}
