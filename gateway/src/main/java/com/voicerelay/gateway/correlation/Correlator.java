package com.voicerelay.gateway.correlation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.voicerelay.common.LatencyStats;
import com.voicerelay.gateway.NotConnectedException;
import com.voicerelay.gateway.RequestTimeoutException;
import com.voicerelay.gateway.UpstreamErrorException;
import com.voicerelay.gateway.connection.GatewayTransport;
import com.voicerelay.protocol.GatewayMethod;
import com.voicerelay.protocol.RequestFrame;
import com.voicerelay.protocol.ResponseFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns the fire-and-forget frame exchange into awaitable calls.
 *
 * Each request is parked under its id with its own cancellable deadline task.
 * Response and deadline race through a single {@code pending.remove(id)} under
 * the mutex; the loser finds nothing and does nothing. Futures are completed
 * outside the mutex.
 *
 * Responses are matched by id only, so out-of-order delivery is fine. A second
 * response for an id that is no longer pending is ignored.
 *
 * Nothing is queued: with the connection down, {@link #send} fails at once
 * with {@link NotConnectedException}. Nothing is retried either.
 */
public final class Correlator {

    private static final Logger log = LoggerFactory.getLogger(Correlator.class);

    private final Object                   mutex;
    private final GatewayTransport         transport;
    private final ScheduledExecutorService scheduler;
    private final LatencyStats             latency;

    private final Map<String, PendingRequest> pending = new HashMap<>();
    private final AtomicLong                  idSeq   = new AtomicLong();

    public Correlator(Object mutex, GatewayTransport transport, ScheduledExecutorService scheduler, LatencyStats latency) {
        this.mutex     = mutex;
        this.transport = transport;
        this.scheduler = scheduler;
        this.latency   = latency;
    }

    /** Fresh id, unique for the lifetime of the process. */
    public String nextRequestId() {
        return "req_" + System.currentTimeMillis() + "_" + idSeq.incrementAndGet();
    }

    public CompletableFuture<JsonNode> send(GatewayMethod method, ObjectNode params, Duration timeout) {
        return send(nextRequestId(), method, params, timeout);
    }

    /**
     * Register {@code requestId} and write the request. The returned future
     * completes with the response payload, or exceptionally with
     * {@link NotConnectedException}, {@link RequestTimeoutException} or
     * {@link UpstreamErrorException}. Cancelling it drops the local entry only;
     * the gateway is not told.
     */
    public CompletableFuture<JsonNode> send(String requestId, GatewayMethod method, ObjectNode params, Duration timeout) {
        if (!transport.isAuthenticated()) {
            log.warn("Rejecting {} {}: gateway not connected", method.wire, requestId);
            return CompletableFuture.failedFuture(new NotConnectedException());
        }
        if (method.turnInitiating) {
            params.put("idempotencyKey", requestId);
        }

        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        PendingRequest request = new PendingRequest(requestId, method, timeout, future);
        synchronized (mutex) {
            if (pending.containsKey(requestId)) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Request id already pending: " + requestId));
            }
            pending.put(requestId, request);
            request.deadlineTask(scheduler.schedule(
                    () -> expire(requestId), timeout.toMillis(), TimeUnit.MILLISECONDS));
        }
        future.whenComplete((r, e) -> {
            if (future.isCancelled()) abandon(requestId);
        });

        try {
            transport.write(new RequestFrame(requestId, method, params));
        } catch (RuntimeException e) {
            fail(requestId, e);
        }
        log.debug("Sent {} {}, deadline {}", method.wire, requestId, request.deadline());
        return future;
    }

    /**
     * Route a response to its caller.
     *
     * @return true if a pending request was completed
     */
    public boolean complete(ResponseFrame response) {
        PendingRequest request;
        synchronized (mutex) {
            request = pending.remove(response.id());
        }
        if (request == null) {
            log.debug("No pending request for response {}, ignoring", response.id());
            return false;
        }
        request.cancelDeadline();
        latency.record(System.nanoTime() - request.createdNanos);

        if (response.isError()) {
            log.warn("{} {} failed upstream: {}", request.method.wire, request.id, response.errorMessage());
            request.future.completeExceptionally(new UpstreamErrorException(request.method, response.errorMessage()));
        } else {
            request.future.complete(response.payload() != null ? response.payload() : NullNode.getInstance());
        }
        return true;
    }

    private void expire(String requestId) {
        PendingRequest request;
        synchronized (mutex) {
            request = pending.remove(requestId);
        }
        if (request == null) return;
        log.warn("{} {} timed out after {}ms", request.method.wire, requestId, request.timeout.toMillis());
        request.future.completeExceptionally(new RequestTimeoutException(request.method, requestId, request.timeout));
    }

    private void fail(String requestId, Throwable cause) {
        PendingRequest request;
        synchronized (mutex) {
            request = pending.remove(requestId);
        }
        if (request == null) return;
        request.cancelDeadline();
        request.future.completeExceptionally(cause);
    }

    private void abandon(String requestId) {
        PendingRequest request;
        synchronized (mutex) {
            request = pending.remove(requestId);
        }
        if (request == null) return;
        request.cancelDeadline();
        log.debug("{} {} abandoned by caller", request.method.wire, requestId);
    }

    public boolean isPending(String requestId) {
        synchronized (mutex) {
            return pending.containsKey(requestId);
        }
    }

    public int pendingCount() {
        synchronized (mutex) {
            return pending.size();
        }
    }
}
