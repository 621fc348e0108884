package com.voicerelay.protocol;

/**
 * Stream channel of an {@code agent} event. Streams other than assistant
 * text and lifecycle (tool output etc.) are folded into {@link #OTHER}.
 */
public enum AgentStream {
    ASSISTANT,
    LIFECYCLE,
    OTHER;

    public static AgentStream fromWire(String wire) {
        if ("assistant".equals(wire)) return ASSISTANT;
        if ("lifecycle".equals(wire)) return LIFECYCLE;
        return OTHER;
    }
}
