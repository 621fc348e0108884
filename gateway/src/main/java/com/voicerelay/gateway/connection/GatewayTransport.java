package com.voicerelay.gateway.connection;

import com.voicerelay.protocol.RequestFrame;

/**
 * The upstream connection as seen by the request path.
 */
public interface GatewayTransport {

    /** Start connecting; a no-op while an attempt is running or the link is up. */
    void connect();

    /** Close for good; no reconnect follows. */
    void stop();

    boolean isAuthenticated();

    /**
     * Write one request frame. Whole frames are written; concurrent callers
     * never interleave.
     *
     * @throws com.voicerelay.gateway.NotConnectedException if not authenticated
     */
    void write(RequestFrame frame);
}
