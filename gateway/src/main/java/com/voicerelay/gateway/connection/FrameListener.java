package com.voicerelay.gateway.connection;

import com.voicerelay.protocol.GatewayFrame;

/**
 * Receives application frames (responses and agent events) once the
 * connection is authenticated. Called on the connection's event loop, one
 * frame at a time in arrival order.
 */
@FunctionalInterface
public interface FrameListener {

    void onFrame(GatewayFrame frame);
}
