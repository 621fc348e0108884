package com.voicerelay.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * {@code {type:"req", id, method, params}}
 */
public record RequestFrame(String id, GatewayMethod method, ObjectNode params) implements GatewayFrame {

    @Override
    public FrameType type() { return FrameType.REQ; }
}
