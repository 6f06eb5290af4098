package com.mcpbuilder.core.realtime;

import java.util.Map;

/**
 * Point-in-time view of the registry.
 *
 * @param totalConnections     connections held by the registry
 * @param activeConnections    connections whose transport reported open when the stats were taken
 * @param subscriptionsByTopic subscribed connection count per topic
 * @param connectionsByUser    connection count per user
 */
public record ConnectionStats(
    int totalConnections,
    int activeConnections,
    Map<String, Integer> subscriptionsByTopic,
    Map<String, Integer> connectionsByUser
) {}
