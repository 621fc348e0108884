package com.voicerelay.protocol;

/**
 * The fixed set of request methods the relay issues upstream.
 *
 * Turn-initiating methods start an agent run and carry an
 * {@code idempotencyKey} equal to the request id; the others are metadata queries.
 */
public enum GatewayMethod {
    CONNECT       ("connect",       false),
    CHAT_SEND     ("chat.send",     true),
    CHAT_HISTORY  ("chat.history",  false),
    SESSIONS_LIST ("sessions.list", false);

    public final String  wire;
    public final boolean turnInitiating;

    GatewayMethod(String wire, boolean turnInitiating) {
        this.wire           = wire;
        this.turnInitiating = turnInitiating;
    }

    public static GatewayMethod fromWire(String wire) {
        for (GatewayMethod m : values()) {
            if (m.wire.equals(wire)) return m;
        }
        throw new IllegalArgumentException("Unknown method: " + wire);
    }
}
