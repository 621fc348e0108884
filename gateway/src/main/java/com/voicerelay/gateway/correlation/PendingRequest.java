package com.voicerelay.gateway.correlation;

import com.fasterxml.jackson.databind.JsonNode;
import com.voicerelay.protocol.GatewayMethod;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * One in-flight request. Owned by the {@link Correlator} while pending;
 * whichever of response or deadline removes it from the pending map completes it.
 */
final class PendingRequest {

    final String                      id;
    final GatewayMethod               method;
    final Instant                     createdAt;
    final long                        createdNanos;
    final Duration                    timeout;
    final CompletableFuture<JsonNode> future;

    // Set under the correlator mutex right after registration
    private ScheduledFuture<?> deadlineTask;

    PendingRequest(String id, GatewayMethod method, Duration timeout, CompletableFuture<JsonNode> future) {
        this.id           = id;
        this.method       = method;
        this.createdAt    = Instant.now();
        this.createdNanos = System.nanoTime();
        this.timeout      = timeout;
        this.future       = future;
    }

    Instant deadline() {
        return createdAt.plus(timeout);
    }

    void deadlineTask(ScheduledFuture<?> task) {
        this.deadlineTask = task;
    }

    void cancelDeadline() {
        ScheduledFuture<?> task = deadlineTask;
        if (task != null) task.cancel(false);
    }
}
