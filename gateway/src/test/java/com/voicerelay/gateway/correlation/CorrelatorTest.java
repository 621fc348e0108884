package com.voicerelay.gateway.correlation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.voicerelay.common.LatencyStats;
import com.voicerelay.gateway.NotConnectedException;
import com.voicerelay.gateway.RecordingTransport;
import com.voicerelay.gateway.RequestTimeoutException;
import com.voicerelay.gateway.UpstreamErrorException;
import com.voicerelay.protocol.GatewayMethod;
import com.voicerelay.protocol.RequestFrame;
import com.voicerelay.protocol.ResponseFrame;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class CorrelatorTest {

    private static final Duration LONG = Duration.ofSeconds(30);

    private final ObjectMapper mapper = new ObjectMapper();

    private ScheduledExecutorService scheduler;
    private RecordingTransport transport;
    private LatencyStats latency;
    private Correlator correlator;

    @BeforeEach
    void setUp() {
        scheduler  = Executors.newSingleThreadScheduledExecutor();
        transport  = new RecordingTransport(true);
        latency    = new LatencyStats("test");
        correlator = new Correlator(new Object(), transport, scheduler, latency);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private ObjectNode params() {
        return mapper.createObjectNode();
    }

    private ResponseFrame ok(String id, JsonNode payload) {
        return new ResponseFrame(id, true, payload, null);
    }

    private static Throwable failureOf(CompletableFuture<?> f) throws InterruptedException {
        try {
            f.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (TimeoutException e) {
            fail("future did not complete");
        }
        fail("future completed normally");
        return null;
    }

    // ---- Test 1: no connection means immediate failure, nothing written ----
    @Test
    void notConnectedFailsImmediately() throws Exception {
        transport.setAuthenticated(false);

        CompletableFuture<JsonNode> f = correlator.send(GatewayMethod.SESSIONS_LIST, params(), LONG);

        assertTrue(f.isDone(), "Must fail without waiting for a timeout");
        assertInstanceOf(NotConnectedException.class, failureOf(f));
        assertTrue(transport.written.isEmpty(), "No frame may be written");
        assertEquals(0, correlator.pendingCount());
    }

    // ---- Test 2: response completes the matching caller ----
    @Test
    void responseResolvesCaller() throws Exception {
        CompletableFuture<JsonNode> f = correlator.send(GatewayMethod.SESSIONS_LIST, params(), LONG);
        RequestFrame sent = transport.last();
        assertTrue(correlator.isPending(sent.id()));

        ObjectNode payload = mapper.createObjectNode().put("count", 2);
        assertTrue(correlator.complete(ok(sent.id(), payload)));

        assertEquals(2, f.get(1, TimeUnit.SECONDS).get("count").asInt());
        assertFalse(correlator.isPending(sent.id()));
        assertEquals(1, latency.count());
    }

    // ---- Test 3: out-of-order responses ----
    @Test
    void responsesMatchedByIdNotOrder() throws Exception {
        CompletableFuture<JsonNode> first  = correlator.send(GatewayMethod.SESSIONS_LIST, params(), LONG);
        CompletableFuture<JsonNode> second = correlator.send(GatewayMethod.CHAT_HISTORY, params(), LONG);
        String firstId  = transport.written.get(0).id();
        String secondId = transport.written.get(1).id();
        assertNotEquals(firstId, secondId);

        correlator.complete(ok(secondId, mapper.createObjectNode().put("who", "second")));
        correlator.complete(ok(firstId, mapper.createObjectNode().put("who", "first")));

        assertEquals("first", first.get(1, TimeUnit.SECONDS).get("who").asText());
        assertEquals("second", second.get(1, TimeUnit.SECONDS).get("who").asText());
    }

    // ---- Test 4: upstream error surfaces verbatim ----
    @Test
    void upstreamErrorFailsCaller() throws Exception {
        CompletableFuture<JsonNode> f = correlator.send(GatewayMethod.CHAT_HISTORY, params(), LONG);
        String id = transport.last().id();

        correlator.complete(new ResponseFrame(id, false, null, "session not found"));

        UpstreamErrorException err = assertInstanceOf(UpstreamErrorException.class, failureOf(f));
        assertEquals("session not found", err.getMessage());
        assertEquals(GatewayMethod.CHAT_HISTORY, err.method());
    }

    // ---- Test 5: at most one completion per id ----
    @Test
    void duplicateResponseIsIgnored() throws Exception {
        CompletableFuture<JsonNode> f = correlator.send(GatewayMethod.SESSIONS_LIST, params(), LONG);
        String id = transport.last().id();

        assertTrue(correlator.complete(ok(id, mapper.createObjectNode().put("n", 1))));
        assertFalse(correlator.complete(ok(id, mapper.createObjectNode().put("n", 2))));
        assertFalse(correlator.complete(ok("req_unknown", null)));

        assertEquals(1, f.get().get("n").asInt());
    }

    @Test
    void missingPayloadCompletesWithNullNode() throws Exception {
        CompletableFuture<JsonNode> f = correlator.send(GatewayMethod.SESSIONS_LIST, params(), LONG);
        correlator.complete(ok(transport.last().id(), null));
        assertTrue(f.get(1, TimeUnit.SECONDS).isNull());
    }

    // ---- Test 6: timeout fires once, late response is a no-op ----
    @Test
    void timeoutThenLateResponse() throws Exception {
        CompletableFuture<JsonNode> f = correlator.send(GatewayMethod.SESSIONS_LIST, params(), Duration.ofMillis(50));
        String id = transport.last().id();

        RequestTimeoutException timeout = assertInstanceOf(RequestTimeoutException.class, failureOf(f));
        assertEquals(id, timeout.requestId());
        assertFalse(correlator.isPending(id));

        assertFalse(correlator.complete(ok(id, mapper.createObjectNode())), "Late response must be dropped");
        assertTrue(f.isCompletedExceptionally());
    }

    // ---- Test 7: deadlines are per request, unaffected by the link going down ----
    @Test
    void independentDeadlinesAcrossDisconnect() throws Exception {
        long start = System.nanoTime();
        CompletableFuture<JsonNode> query = correlator.send(GatewayMethod.SESSIONS_LIST, params(), Duration.ofMillis(150));
        CompletableFuture<JsonNode> chat  = correlator.send(GatewayMethod.CHAT_SEND, params(), Duration.ofMillis(800));

        transport.setAuthenticated(false);

        assertInstanceOf(RequestTimeoutException.class, failureOf(query));
        assertFalse(chat.isDone(), "Longer deadline must still be running");

        transport.setAuthenticated(true);

        assertInstanceOf(RequestTimeoutException.class, failureOf(chat));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertTrue(elapsedMs >= 750, "chat.send must wait for its own deadline, took " + elapsedMs + "ms");
        assertEquals(0, correlator.pendingCount());
    }

    // ---- Test 8: idempotency key only on turn-initiating requests ----
    @Test
    void idempotencyKeyOnChatSendOnly() {
        correlator.send(GatewayMethod.CHAT_SEND, params().put("message", "hi"), LONG);
        RequestFrame chat = transport.last();
        assertEquals(chat.id(), chat.params().get("idempotencyKey").asText());

        correlator.send(GatewayMethod.SESSIONS_LIST, params(), LONG);
        assertFalse(transport.last().params().has("idempotencyKey"));
    }

    // ---- Test 9: caller abandonment ----
    @Test
    void cancelDropsLocalEntry() {
        CompletableFuture<JsonNode> f = correlator.send(GatewayMethod.SESSIONS_LIST, params(), LONG);
        String id = transport.last().id();

        assertTrue(f.cancel(false));

        assertFalse(correlator.isPending(id));
        assertFalse(correlator.complete(ok(id, null)));
        assertEquals(1, transport.written.size(), "Gateway is not told about the cancellation");
    }

    // ---- Test 10: write failure completes the caller ----
    @Test
    void writeFailureFailsCaller() throws Exception {
        transport.setFailWrites(true);
        CompletableFuture<JsonNode> f = correlator.send(GatewayMethod.SESSIONS_LIST, params(), LONG);

        assertInstanceOf(IllegalStateException.class, failureOf(f));
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void explicitIdCannotBeReusedWhilePending() throws Exception {
        correlator.send("req_fixed", GatewayMethod.SESSIONS_LIST, params(), LONG);
        CompletableFuture<JsonNode> dup = correlator.send("req_fixed", GatewayMethod.SESSIONS_LIST, params(), LONG);

        assertInstanceOf(IllegalStateException.class, failureOf(dup));
        assertEquals(1, correlator.pendingCount());
    }

    // ---- Test 11: concurrent senders, each resolved exactly once ----
    @Test
    void concurrentSendersGetTheirOwnResponses() throws Exception {
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<List<CompletableFuture<JsonNode>>>> batches = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                batches.add(pool.submit(() -> {
                    List<CompletableFuture<JsonNode>> mine = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        mine.add(correlator.send(GatewayMethod.SESSIONS_LIST, mapper.createObjectNode(), LONG));
                    }
                    return mine;
                }));
            }
            List<CompletableFuture<JsonNode>> all = new ArrayList<>();
            for (Future<List<CompletableFuture<JsonNode>>> b : batches) all.addAll(b.get(5, TimeUnit.SECONDS));

            Set<String> ids = new HashSet<>();
            for (RequestFrame frame : transport.written) ids.add(frame.id());
            assertEquals(threads * perThread, ids.size(), "Request ids must be unique");

            for (RequestFrame frame : transport.written) {
                assertTrue(correlator.complete(ok(frame.id(), mapper.createObjectNode().put("id", frame.id()))));
            }
            for (int i = 0; i < all.size(); i++) {
                JsonNode payload = all.get(i).get(1, TimeUnit.SECONDS);
                assertTrue(ids.contains(payload.get("id").asText()));
            }
            assertEquals(0, correlator.pendingCount());
        } finally {
            pool.shutdownNow();
        }
    }
}
