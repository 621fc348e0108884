package com.voicerelay.protocol;

/**
 * {@code {type:"event", event:"connect.challenge", payload:{nonce}}}
 */
public record ChallengeFrame(String nonce) implements GatewayFrame {

    @Override
    public FrameType type() { return FrameType.EVENT; }
}
