package com.mcpbuilder.dispatch.api;

import com.mcpbuilder.core.model.Frame;

/**
 * Inbound JSON body for POST /api/v1/realtime/broadcast/user.
 */
public record BroadcastToUserRequest(
    String targetUserId,
    Frame message
) {}
