package com.voicerelay.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON bodies exchanged with the browser, over HTTP and the push socket.
 */
public final class JsonMessages {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonMessages() {}

    // ── Browser → Bridge ─────────────────────────────────────────────────────

    /** Parse a request body; an empty body reads as an empty object. */
    public static JsonNode parse(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) return MAPPER.createObjectNode();
        return MAPPER.readTree(json);
    }

    /** Non-blank text field, or null. */
    public static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual() || v.asText().isBlank()) return null;
        return v.asText();
    }

    // ── Bridge → Browser ─────────────────────────────────────────────────────

    public static String connected() {
        return obj("type", "connected");
    }

    public static String taskAccepted(String taskId) {
        return obj("taskId", taskId);
    }

    /** Browser clients read the raw acknowledgement as text. */
    public static String chatAck(JsonNode ack, String taskId) {
        String text = ack == null || ack.isNull() ? "Request processed"
                : ack.isTextual() ? ack.asText() : ack.toString();
        return obj("text", text, "taskId", taskId);
    }

    public static String health(boolean gatewayConnected, int clients) {
        return obj("status", "ok", "gatewayConnected", gatewayConnected, "clients", clients);
    }

    public static String sessionReset(String sessionKey) {
        return obj("status", "ok", "sessionKey", sessionKey);
    }

    public static String error(String message) {
        return obj("error", message);
    }

    public static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return error("serialize failed");
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static String obj(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
        try {
            return MAPPER.writeValueAsString(m);
        } catch (JsonProcessingException e) {
            return "{\"error\":\"serialize failed\"}";
        }
    }
}
