package com.mcpbuilder.core.realtime;

import com.mcpbuilder.core.metrics.RealtimeMetrics;
import com.mcpbuilder.core.model.Frame;
import com.mcpbuilder.core.model.ProgressUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Pushes frames to the connections subscribed to a topic or owned by a user.
 * <p>
 * Each frame is encoded once per call. A failed send only means that peer missed the
 * frame: it is counted as a failure, never raised, and never stops delivery to the rest.
 */
@Service
public class BroadcastService {

    private static final Logger log = LoggerFactory.getLogger(BroadcastService.class);

    private final ConnectionRegistry registry;
    private final FrameCodec codec;
    private final RealtimeMetrics metrics;

    public BroadcastService(ConnectionRegistry registry, FrameCodec codec, RealtimeMetrics metrics) {
        this.registry = registry;
        this.codec = codec;
        this.metrics = metrics;
    }

    public int broadcastToTopic(String topicId, ProgressUpdate update) {
        return broadcastToTopic(topicId, update, null);
    }

    /**
     * Sends a {@code progress} frame to every connection subscribed to {@code topicId}.
     *
     * @param excludeUserId connections owned by this user are skipped (nullable)
     * @return number of connections the frame was delivered to
     */
    public int broadcastToTopic(String topicId, ProgressUpdate update, String excludeUserId) {
        List<ProgressConnection> subscribers = registry.topicSnapshot(topicId);
        if (subscribers.isEmpty()) {
            return 0;
        }
        Instant now = registry.clock().instant();
        String payload = codec.encode(Frame.progress(update, now));

        int sent = 0;
        for (ProgressConnection connection : subscribers) {
            if (excludeUserId != null && excludeUserId.equals(connection.userId())) {
                continue;
            }
            if (deliver(connection, payload, now)) {
                sent++;
            }
        }
        log.debug("Broadcast {} for project {} reached {}/{} connections",
                update.phase(), topicId, sent, subscribers.size());
        return sent;
    }

    /**
     * Sends {@code message} to every connection owned by {@code userId}.
     *
     * @return number of connections the frame was delivered to
     */
    public int sendToUser(String userId, Frame message) {
        List<ProgressConnection> owned = registry.userSnapshot(userId);
        if (owned.isEmpty()) {
            return 0;
        }
        Instant now = registry.clock().instant();
        String payload = codec.encode(message);

        int sent = 0;
        for (ProgressConnection connection : owned) {
            if (deliver(connection, payload, now)) {
                sent++;
            }
        }
        log.debug("Sent {} frame to {}/{} connections of user {}",
                message.type(), sent, owned.size(), userId);
        return sent;
    }

    private boolean deliver(ProgressConnection connection, String payload, Instant now) {
        boolean sent = connection.send(payload, now);
        metrics.recordDelivery(sent);
        return sent;
    }
}
