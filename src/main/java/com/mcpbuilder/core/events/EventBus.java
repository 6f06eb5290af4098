package com.mcpbuilder.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus carrying {@link BuildEvent}s from the build pipeline.
 * <p>
 * Supports per-project subscriptions and global subscriptions that receive every event.
 * A subscriber that throws is logged and skipped; it never blocks the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<BuildEvent>>> projectSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<BuildEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to the project's subscribers, then to the global ones.
     */
    public void publish(BuildEvent event) {
        log.debug("Publishing {} ({}) for project {}", event.type(), event.phase(), event.projectId());

        List<Consumer<BuildEvent>> projectSubs = projectSubscribers.get(event.projectId());
        if (projectSubs != null) {
            for (Consumer<BuildEvent> subscriber : projectSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<BuildEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String projectId, Consumer<BuildEvent> consumer) {
        projectSubscribers.computeIfAbsent(projectId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to build events of project {}", projectId);
        return () -> projectSubscribers.computeIfPresent(projectId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<BuildEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    public int subscriberCount(String projectId) {
        List<Consumer<BuildEvent>> subs = projectSubscribers.get(projectId);
        return (subs != null ? subs.size() : 0) + globalSubscribers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<BuildEvent> subscriber, BuildEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {} for project {}: {}",
                    event.type(), event.projectId(), e.getMessage(), e);
        }
    }
}
