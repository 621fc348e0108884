package com.voicerelay.protocol;

/**
 * Value of the {@code type} discriminator carried by every gateway frame.
 */
public enum FrameType {
    REQ   ("req"),
    RES   ("res"),
    EVENT ("event");

    public final String wire;

    FrameType(String wire) { this.wire = wire; }

    public static FrameType fromWire(String wire) throws FrameDecodingException {
        for (FrameType t : values()) {
            if (t.wire.equals(wire)) return t;
        }
        throw new FrameDecodingException("Unknown frame type: " + wire);
    }
}
