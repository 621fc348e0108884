package com.voicerelay.protocol;

/**
 * {@code tick} / {@code health} events. Never dispatched past the connection.
 */
public record HeartbeatFrame(GatewayEvent event) implements GatewayFrame {

    @Override
    public FrameType type() { return FrameType.EVENT; }
}
