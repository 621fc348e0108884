package com.voicerelay.protocol;

/**
 * Event names this relay understands on {@code type=event} frames.
 * Anything else is reported as {@link UnsupportedFrameException}.
 */
public enum GatewayEvent {
    CONNECT_CHALLENGE ("connect.challenge"),
    AGENT             ("agent"),
    TICK              ("tick"),
    HEALTH            ("health");

    public final String wire;

    GatewayEvent(String wire) { this.wire = wire; }

    public boolean isHeartbeat() {
        return this == TICK || this == HEALTH;
    }

    public static GatewayEvent fromWire(String wire) throws UnsupportedFrameException {
        for (GatewayEvent e : values()) {
            if (e.wire.equals(wire)) return e;
        }
        throw new UnsupportedFrameException("Unsupported event: " + wire);
    }
}
