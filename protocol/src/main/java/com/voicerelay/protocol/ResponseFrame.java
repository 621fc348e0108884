package com.voicerelay.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code {type:"res", id, ok, payload}} or {@code {type:"res", id, error}}.
 *
 * @param payload      result payload ({@code result} or {@code payload} on the wire), may be null
 * @param errorMessage upstream error text, null on success
 */
public record ResponseFrame(String id, boolean ok, JsonNode payload, String errorMessage) implements GatewayFrame {

    @Override
    public FrameType type() { return FrameType.RES; }

    public boolean isError() {
        return errorMessage != null;
    }

    /** The {@code runId} an acknowledgement of a turn-initiating request carries, or null. */
    public String runId() {
        if (payload == null || !payload.isObject()) return null;
        JsonNode runId = payload.get("runId");
        return runId != null && runId.isTextual() && !runId.asText().isEmpty() ? runId.asText() : null;
    }
}
