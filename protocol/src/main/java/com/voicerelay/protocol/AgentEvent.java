package com.voicerelay.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code {type:"event", event:"agent", payload:{runId, stream, data, sessionKey}}}
 *
 * @param data       stream-specific body, never null (empty object when absent)
 * @param sessionKey canonical session key the run belongs to, may be null
 */
public record AgentEvent(String runId, AgentStream stream, JsonNode data, String sessionKey) implements GatewayFrame {

    public static final String PHASE_START = "start";
    public static final String PHASE_END   = "end";

    @Override
    public FrameType type() { return FrameType.EVENT; }

    /** Full assistant text so far; empty when the event carries none. */
    public String text() {
        return data.path("text").asText("");
    }

    public String phase() {
        return data.path("phase").asText("");
    }

    public boolean isLifecycleStart() {
        return stream == AgentStream.LIFECYCLE && PHASE_START.equals(phase());
    }

    public boolean isLifecycleEnd() {
        return stream == AgentStream.LIFECYCLE && PHASE_END.equals(phase());
    }
}
