package com.mcpbuilder.core.realtime;

import java.io.IOException;

/**
 * The duplex channel behind one {@link ProgressConnection}.
 * <p>
 * Only the owning connection writes to or closes a transport. The registry subscribes
 * to its inbound events exactly once, at admission.
 */
public interface ConnectionTransport {

    /**
     * Live transport state at the instant of the call.
     */
    boolean isOpen();

    /**
     * Sends one text frame. Implementations must return or fail within a bounded time.
     *
     * @throws IOException if the frame could not be handed to the peer
     */
    void send(String payload) throws IOException;

    void close() throws IOException;

    /**
     * Registers the single listener for inbound frames, close and error events.
     *
     * @throws IllegalStateException if a listener is already registered
     */
    void listen(Listener listener);

    interface Listener {

        void onMessage(String payload);

        void onClose();

        void onError(Throwable error);
    }
}
