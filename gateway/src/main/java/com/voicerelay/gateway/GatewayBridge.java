package com.voicerelay.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.voicerelay.gateway.broadcast.BroadcastListener;
import com.voicerelay.protocol.GatewayMethod;

import java.util.concurrent.CompletableFuture;

/**
 * What the browser-facing layer sees of the gateway session.
 */
public interface GatewayBridge {

    /**
     * Issue one request and await its response. Fails with
     * {@link NotConnectedException}, {@link RequestTimeoutException} or
     * {@link UpstreamErrorException}.
     */
    CompletableFuture<JsonNode> sendRequest(GatewayMethod method, ObjectNode params);

    /** Start an agent turn in the current conversation, or in {@code sessionKey} when given. */
    ChatSubmission sendChat(String message, String sessionKey);

    default ChatSubmission sendChat(String message) {
        return sendChat(message, null);
    }

    CompletableFuture<JsonNode> listSessions();

    CompletableFuture<JsonNode> history(String sessionKey);

    /** Start a new conversation. Runs of the previous one are abandoned. */
    String resetSession();

    String currentSessionKey();

    long subscribe(BroadcastListener listener);

    boolean unsubscribe(long handle);

    int subscriberCount();

    boolean isConnected();
}
