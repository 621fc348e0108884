package com.voicerelay.gateway.broadcast;

/**
 * A downstream push channel, e.g. one browser tab's WebSocket.
 */
public interface BroadcastListener {

    boolean isOpen();

    /**
     * Deliver one serialized event. Throwing removes this listener from the
     * broadcaster; other listeners still get the event.
     */
    void send(String json) throws Exception;
}
