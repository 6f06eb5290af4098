package com.mcpbuilder.core.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.mcpbuilder.core.logging.MdcContext;
import com.mcpbuilder.core.metrics.RealtimeMetrics;
import com.mcpbuilder.core.model.ErrorCode;
import com.mcpbuilder.core.model.Frame;
import com.mcpbuilder.core.model.FrameType;
import com.mcpbuilder.core.model.ProgressUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Handles inbound frames from admitted connections.
 * <p>
 * Recognised frames are {@code subscribe}, {@code unsubscribe}, {@code ping} and {@code pong}.
 * Anything else, including malformed JSON, is answered with an {@code error} frame and the
 * connection stays open. Frames for a connection that has already been removed are dropped.
 */
@Service
public class MessageDispatcher implements InboundFrameHandler {

    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    private final ConnectionRegistry registry;
    private final FrameCodec codec;
    private final TopicAccessPolicy accessPolicy;
    private final RealtimeMetrics metrics;

    public MessageDispatcher(ConnectionRegistry registry,
                             FrameCodec codec,
                             TopicAccessPolicy accessPolicy,
                             RealtimeMetrics metrics) {
        this.registry = registry;
        this.codec = codec;
        this.accessPolicy = accessPolicy;
        this.metrics = metrics;
    }

    @Override
    public void onFrame(String connectionId, String payload) {
        Optional<String> owner = registry.ownerOf(connectionId);
        if (owner.isEmpty()) {
            log.debug("Dropping frame for unknown connection {}", connectionId);
            return;
        }
        registry.touch(connectionId);

        MdcContext.setConnection(connectionId, owner.get());
        try {
            dispatch(connectionId, owner.get(), payload);
        } finally {
            MdcContext.clear();
        }
    }

    private void dispatch(String connectionId, String userId, String payload) {
        JsonNode frame;
        try {
            frame = codec.decode(payload);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable frame on connection {}: {}", connectionId, e.getOriginalMessage());
            replyError(connectionId, ErrorCode.INVALID_MESSAGE);
            return;
        }
        if (frame == null || !frame.isObject()) {
            replyError(connectionId, ErrorCode.INVALID_MESSAGE);
            return;
        }

        Optional<FrameType> type = FrameType.fromWire(frame.path("type").asText(null));
        if (type.isEmpty()) {
            replyError(connectionId, ErrorCode.UNKNOWN_MESSAGE_TYPE);
            return;
        }

        switch (type.get()) {
            case SUBSCRIBE -> handleSubscribe(connectionId, userId, frame.path("data"));
            case UNSUBSCRIBE -> handleUnsubscribe(connectionId, frame.path("data"));
            case PING -> reply(connectionId, Frame.pong(now()));
            case PONG -> log.debug("Heartbeat acknowledged on connection {}", connectionId);
            default -> replyError(connectionId, ErrorCode.UNKNOWN_MESSAGE_TYPE);
        }
    }

    private void handleSubscribe(String connectionId, String userId, JsonNode data) {
        String projectId = projectId(data);
        if (projectId == null) {
            replyError(connectionId, ErrorCode.MISSING_PROJECT_ID);
            return;
        }
        MdcContext.setProject(projectId);

        if (!accessPolicy.canSubscribe(userId, projectId)) {
            log.info("User {} denied subscription to project {}", userId, projectId);
            replyError(connectionId, ErrorCode.ACCESS_DENIED);
            return;
        }
        if (!registry.subscribe(connectionId, projectId)) {
            return;
        }
        reply(connectionId, Frame.progress(ProgressUpdate.of(projectId, "subscribed", 0,
                "Subscribed to project " + projectId, now()), now()));
    }

    private void handleUnsubscribe(String connectionId, JsonNode data) {
        String projectId = projectId(data);
        if (projectId == null) {
            replyError(connectionId, ErrorCode.MISSING_PROJECT_ID);
            return;
        }
        MdcContext.setProject(projectId);

        if (!registry.unsubscribe(connectionId, projectId)) {
            return;
        }
        reply(connectionId, Frame.progress(ProgressUpdate.of(projectId, "unsubscribed", 0,
                "Unsubscribed from project " + projectId, now()), now()));
    }

    private static String projectId(JsonNode data) {
        JsonNode node = data.path("projectId");
        if (!node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }

    private void replyError(String connectionId, ErrorCode code) {
        metrics.recordProtocolError(code.name());
        reply(connectionId, Frame.error(code, now()));
    }

    private void reply(String connectionId, Frame frame) {
        registry.sendTo(connectionId, codec.encode(frame));
    }

    private Instant now() {
        return registry.clock().instant();
    }
}
