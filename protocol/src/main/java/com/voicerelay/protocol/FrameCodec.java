package com.voicerelay.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON codec for gateway frames.
 *
 * Decoding validates the {@code type} discriminator and the fields each frame
 * kind needs before anything is dispatched:
 * <pre>
 *   res                          → ResponseFrame  (id required)
 *   event / connect.challenge    → ChallengeFrame (payload.nonce required)
 *   event / agent                → AgentEvent     (payload.runId required)
 *   event / tick | health        → HeartbeatFrame
 *   event / anything else        → UnsupportedFrameException
 *   req                          → UnsupportedFrameException (the gateway never calls us)
 * </pre>
 *
 * Thread-safe: the underlying ObjectMapper is shared.
 */
public final class FrameCodec {

    private final ObjectMapper mapper;

    public FrameCodec() {
        this(new ObjectMapper());
    }

    public FrameCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public ObjectNode newObject() {
        return mapper.createObjectNode();
    }

    // ── Inbound ──────────────────────────────────────────────────────────────

    public GatewayFrame decode(String text) throws FrameDecodingException {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new FrameDecodingException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new FrameDecodingException("Frame is not a JSON object");
        }

        FrameType type = FrameType.fromWire(root.path("type").asText(""));
        return switch (type) {
            case RES   -> decodeResponse(root);
            case EVENT -> decodeEvent(root);
            case REQ   -> throw new UnsupportedFrameException("Inbound request not supported: " + root.path("method").asText(""));
        };
    }

    private ResponseFrame decodeResponse(JsonNode root) throws FrameDecodingException {
        String id = requireText(root, "id", "response");
        boolean ok = root.path("ok").asBoolean(false);

        JsonNode payload = root.get("result");
        if (payload == null || payload.isNull()) payload = root.get("payload");
        if (payload != null && payload.isNull()) payload = null;

        String error = errorMessage(root.get("error"));
        if (error == null && root.has("ok") && !ok) {
            error = "Request failed";
        }
        return new ResponseFrame(id, error == null, payload, error);
    }

    private GatewayFrame decodeEvent(JsonNode root) throws FrameDecodingException {
        String name = requireText(root, "event", "event");
        GatewayEvent event = GatewayEvent.fromWire(name);
        if (event.isHeartbeat()) return new HeartbeatFrame(event);

        JsonNode payload = root.get("payload");
        if (payload == null || !payload.isObject()) {
            throw new FrameDecodingException("Event " + name + " has no payload object");
        }

        return switch (event) {
            case CONNECT_CHALLENGE -> new ChallengeFrame(requireText(payload, "nonce", name));
            case AGENT             -> decodeAgent(payload);
            default                -> throw new UnsupportedFrameException("Unsupported event: " + name);
        };
    }

    private AgentEvent decodeAgent(JsonNode payload) throws FrameDecodingException {
        String runId = requireText(payload, "runId", "agent");
        AgentStream stream = AgentStream.fromWire(payload.path("stream").asText(""));

        JsonNode data = payload.get("data");
        if (data == null || !data.isObject()) data = mapper.createObjectNode();

        JsonNode key = payload.get("sessionKey");
        String sessionKey = key != null && key.isTextual() ? key.asText() : null;
        return new AgentEvent(runId, stream, data, sessionKey);
    }

    private static String requireText(JsonNode node, String field, String context) throws FrameDecodingException {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual() || v.asText().isEmpty()) {
            throw new FrameDecodingException("Missing '" + field + "' in " + context + " frame");
        }
        return v.asText();
    }

    private static String errorMessage(JsonNode error) {
        if (error == null || error.isNull() || error.isMissingNode()) return null;
        if (error.isTextual()) return error.asText();
        JsonNode message = error.get("message");
        if (message != null && message.isTextual()) return message.asText();
        return error.toString();
    }

    // ── Outbound ─────────────────────────────────────────────────────────────

    public String encode(RequestFrame frame) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", FrameType.REQ.wire);
        root.put("id", frame.id());
        root.put("method", frame.method().wire);
        root.set("params", frame.params() != null ? frame.params() : mapper.createObjectNode());
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            // tree of plain nodes always serializes
            throw new IllegalStateException("Failed to encode " + frame.method().wire, e);
        }
    }

    public RequestFrame connectRequest(String id, ConnectParams params) {
        ObjectNode node = mapper.valueToTree(params);
        return new RequestFrame(id, GatewayMethod.CONNECT, node);
    }
}
