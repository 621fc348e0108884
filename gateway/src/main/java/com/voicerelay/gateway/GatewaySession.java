package com.voicerelay.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.voicerelay.common.LatencyStats;
import com.voicerelay.common.RelayConfig;
import com.voicerelay.gateway.broadcast.BroadcastListener;
import com.voicerelay.gateway.broadcast.Broadcaster;
import com.voicerelay.gateway.connection.ConnectionSupervisor;
import com.voicerelay.gateway.connection.FrameListener;
import com.voicerelay.gateway.connection.GatewayTransport;
import com.voicerelay.gateway.correlation.Correlator;
import com.voicerelay.gateway.run.RunTracker;
import com.voicerelay.gateway.session.SessionKeyspace;
import com.voicerelay.protocol.AgentEvent;
import com.voicerelay.protocol.FrameCodec;
import com.voicerelay.protocol.GatewayFrame;
import com.voicerelay.protocol.GatewayMethod;
import com.voicerelay.protocol.ResponseFrame;
import io.netty.channel.EventLoopGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide session with the agent gateway.
 *
 * Wires the components together and routes authenticated inbound frames:
 *
 *   ResponseFrame → RunTracker (re-key placeholder on ack) → Correlator (complete caller)
 *   AgentEvent    → RunTracker → Broadcaster (on lifecycle end)
 *
 * The pending-request map and the run map share one mutex. Inbound frames
 * arrive one at a time on the gateway event loop.
 */
public final class GatewaySession implements GatewayBridge, FrameListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewaySession.class);

    private final RelayConfig              cfg;
    private final FrameCodec               codec;
    private final ScheduledExecutorService scheduler;
    private final Object                   mutex   = new Object();
    private final LatencyStats             latency = new LatencyStats("gateway.request");

    private final GatewayTransport transport;
    private final SessionKeyspace  keyspace;
    private final Broadcaster      broadcaster;
    private final RunTracker       runTracker;
    private final Correlator       correlator;

    private ScheduledFuture<?> metricsTask;

    /**
     * @param group event loop group the gateway connection runs on; a single
     *              loop keeps inbound processing strictly sequential
     */
    public GatewaySession(RelayConfig cfg, EventLoopGroup group) {
        this.cfg         = cfg;
        this.codec       = new FrameCodec();
        this.scheduler   = group;
        this.transport   = new ConnectionSupervisor(cfg, group, codec, this);
        this.keyspace    = new SessionKeyspace(cfg.sessionKey, cfg.agentSessionPrefix);
        this.broadcaster = new Broadcaster(codec.mapper());
        this.runTracker  = new RunTracker(mutex, keyspace, broadcaster);
        this.correlator  = new Correlator(mutex, transport, scheduler, latency);
    }

    GatewaySession(RelayConfig cfg, GatewayTransport transport, ScheduledExecutorService scheduler) {
        this.cfg         = cfg;
        this.codec       = new FrameCodec();
        this.scheduler   = scheduler;
        this.transport   = transport;
        this.keyspace    = new SessionKeyspace(cfg.sessionKey, cfg.agentSessionPrefix);
        this.broadcaster = new Broadcaster(codec.mapper());
        this.runTracker  = new RunTracker(mutex, keyspace, broadcaster);
        this.correlator  = new Correlator(mutex, transport, scheduler, latency);
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    public void start() {
        log.info("Starting gateway session: url={} sessionKey={}", cfg.gatewayUrl, keyspace.current());
        transport.connect();
        if (cfg.metricsIntervalSecs > 0) {
            metricsTask = scheduler.scheduleAtFixedRate(latency::logAndReset,
                    cfg.metricsIntervalSecs, cfg.metricsIntervalSecs, TimeUnit.SECONDS);
        }
    }

    @Override
    public void close() {
        if (metricsTask != null) metricsTask.cancel(false);
        transport.stop();
    }

    // ── Inbound (gateway event loop) ─────────────────────────────────────────

    @Override
    public void onFrame(GatewayFrame frame) {
        if (frame instanceof ResponseFrame res) {
            if (!res.isError()) runTracker.onAcknowledged(res.id(), res.runId());
            correlator.complete(res);
        } else if (frame instanceof AgentEvent event) {
            runTracker.onAgentEvent(event);
        } else {
            log.debug("Unhandled {} frame: {}", frame.type(), frame);
        }
    }

    // ── Requests ─────────────────────────────────────────────────────────────

    @Override
    public CompletableFuture<JsonNode> sendRequest(GatewayMethod method, ObjectNode params) {
        if (method == GatewayMethod.CONNECT) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("connect is issued by the connection supervisor"));
        }
        ObjectNode body = params != null ? params : codec.newObject();
        if (method.turnInitiating) {
            return submitTurn(method, body).ack();
        }
        return correlator.send(method, body, timeoutFor(method));
    }

    @Override
    public ChatSubmission sendChat(String message, String sessionKey) {
        ObjectNode params = codec.newObject()
                .put("sessionKey", sessionKey != null && !sessionKey.isBlank() ? sessionKey : keyspace.current())
                .put("message", message);
        return submitTurn(GatewayMethod.CHAT_SEND, params);
    }

    /** Turn requests park a placeholder run before the write so the ack can re-key it. */
    private ChatSubmission submitTurn(GatewayMethod method, ObjectNode params) {
        String requestId = correlator.nextRequestId();
        if (!transport.isAuthenticated()) {
            log.warn("Rejecting {} {}: gateway not connected", method.wire, requestId);
            return new ChatSubmission(null, requestId, CompletableFuture.failedFuture(new NotConnectedException()));
        }

        JsonNode key = params.get("sessionKey");
        if (key == null || !key.isTextual() || key.asText().isBlank()) {
            params.put("sessionKey", keyspace.current());
        }
        String taskId = runTracker.registerPlaceholder(requestId);

        CompletableFuture<JsonNode> ack = correlator.send(requestId, method, params, timeoutFor(method));
        ack.whenComplete((r, e) -> {
            if (e != null) runTracker.discardPlaceholder(requestId);
        });

        log.info("{} {} → task {} (sessionKey={})", method.wire, requestId, taskId, params.get("sessionKey").asText());
        return new ChatSubmission(taskId, requestId, ack);
    }

    @Override
    public CompletableFuture<JsonNode> listSessions() {
        ObjectNode params = codec.newObject()
                .put("limit", cfg.sessionsLimit)
                .put("includeGlobal", true);
        return sendRequest(GatewayMethod.SESSIONS_LIST, params);
    }

    @Override
    public CompletableFuture<JsonNode> history(String sessionKey) {
        ObjectNode params = codec.newObject()
                .put("sessionKey", sessionKey)
                .put("limit", cfg.historyLimit);
        return sendRequest(GatewayMethod.CHAT_HISTORY, params);
    }

    private Duration timeoutFor(GatewayMethod method) {
        return method.turnInitiating
                ? Duration.ofSeconds(cfg.chatTimeoutSecs)
                : Duration.ofSeconds(cfg.queryTimeoutSecs);
    }

    // ── Session key ──────────────────────────────────────────────────────────

    @Override
    public String resetSession() {
        String key;
        int dropped;
        synchronized (mutex) {
            key = keyspace.reset();
            dropped = runTracker.clear();
        }
        log.info("Session reset: sessionKey={} ({} tracked runs abandoned)", key, dropped);
        return key;
    }

    @Override
    public String currentSessionKey() {
        return keyspace.current();
    }

    // ── Downstream listeners ─────────────────────────────────────────────────

    @Override
    public long subscribe(BroadcastListener listener) {
        return broadcaster.subscribe(listener);
    }

    @Override
    public boolean unsubscribe(long handle) {
        return broadcaster.unsubscribe(handle);
    }

    @Override
    public int subscriberCount() {
        return broadcaster.size();
    }

    @Override
    public boolean isConnected() {
        return transport.isAuthenticated();
    }

    // ── Inspection ───────────────────────────────────────────────────────────

    public Correlator correlator() {
        return correlator;
    }

    public RunTracker runTracker() {
        return runTracker;
    }

    public Broadcaster broadcaster() {
        return broadcaster;
    }
}
