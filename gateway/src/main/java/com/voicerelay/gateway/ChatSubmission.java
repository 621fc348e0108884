package com.voicerelay.gateway;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Handle returned for a {@code chat.send}.
 *
 * @param taskId    caller-visible id the streamed result will be published under;
 *                  null when the send was rejected before anything was written
 * @param requestId correlation id of the underlying request
 * @param ack       completes with the gateway's acknowledgement (usually carrying {@code runId})
 */
public record ChatSubmission(String taskId, String requestId, CompletableFuture<JsonNode> ack) {

    public boolean isRejected() {
        return taskId == null;
    }
}
