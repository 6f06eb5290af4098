package com.mcpbuilder.core.realtime;

/**
 * Decides whether a user may subscribe to a topic.
 */
@FunctionalInterface
public interface TopicAccessPolicy {

    boolean canSubscribe(String userId, String topicId);

    static TopicAccessPolicy allowAll() {
        return (userId, topicId) -> true;
    }
}
