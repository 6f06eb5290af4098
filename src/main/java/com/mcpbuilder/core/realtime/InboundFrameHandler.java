package com.mcpbuilder.core.realtime;

/**
 * Receives raw inbound frames for an admitted connection.
 */
@FunctionalInterface
public interface InboundFrameHandler {

    void onFrame(String connectionId, String payload);
}
