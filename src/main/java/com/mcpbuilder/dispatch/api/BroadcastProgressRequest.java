package com.mcpbuilder.dispatch.api;

import com.mcpbuilder.core.model.ProgressUpdate;

/**
 * Inbound JSON body for POST /api/v1/realtime/broadcast/progress.
 *
 * @param projectId     topic to broadcast to
 * @param update        the progress to push
 * @param excludeUserId user whose connections should not receive the update; nullable
 */
public record BroadcastProgressRequest(
    String projectId,
    ProgressUpdate update,
    String excludeUserId
) {}
