package com.voicerelay.protocol;

/**
 * A decoded gateway frame. Implementations form a closed set:
 * {@link RequestFrame} (outbound only), {@link ResponseFrame},
 * {@link ChallengeFrame}, {@link AgentEvent} and {@link HeartbeatFrame}.
 */
public interface GatewayFrame {

    FrameType type();
}
