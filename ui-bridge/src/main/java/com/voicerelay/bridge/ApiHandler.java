package com.voicerelay.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.voicerelay.gateway.ChatSubmission;
import com.voicerelay.gateway.GatewayBridge;
import com.voicerelay.gateway.NotConnectedException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * JSON HTTP endpoints backed by the gateway session.
 *
 *   POST /api/send                      { message, sessionKey? } → { taskId }   (result arrives on /ws)
 *   POST /api/chat                      { message }              → { text, taskId } after the gateway ack
 *   GET  /api/sessions                                           → sessions.list result
 *   GET  /api/sessions/{key}/history                             → chat.history result
 *   GET  /api/health                                             → { status, gatewayConnected, clients }
 *   POST /api/session/reset                                      → { status, sessionKey }
 *
 * Not connected → 503, other gateway failures → 500, bad input → 400.
 * Requests for /ws are consumed by the WebSocket handshake handler before
 * they get here.
 */
final class ApiHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(ApiHandler.class);

    private static final String SESSIONS_PREFIX = "/api/sessions/";
    private static final String HISTORY_SUFFIX  = "/history";

    private final GatewayBridge bridge;

    ApiHandler(GatewayBridge bridge) {
        this.bridge = bridge;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String path = new QueryStringDecoder(req.uri()).rawPath();
        HttpMethod method = req.method();
        boolean keepAlive = HttpUtil.isKeepAlive(req);

        try {
            if (method == HttpMethod.GET && path.equals("/api/health")) {
                respond(ctx, keepAlive, HttpResponseStatus.OK,
                        JsonMessages.health(bridge.isConnected(), bridge.subscriberCount()));
            } else if (method == HttpMethod.POST && path.equals("/api/session/reset")) {
                respond(ctx, keepAlive, HttpResponseStatus.OK, JsonMessages.sessionReset(bridge.resetSession()));
            } else if (method == HttpMethod.POST && path.equals("/api/send")) {
                handleSend(ctx, keepAlive, body(req));
            } else if (method == HttpMethod.POST && path.equals("/api/chat")) {
                handleChat(ctx, keepAlive, body(req));
            } else if (method == HttpMethod.GET && path.equals("/api/sessions")) {
                relay(ctx, keepAlive, "sessions.list", bridge.listSessions());
            } else if (method == HttpMethod.GET && isHistoryPath(path)) {
                String key = QueryStringDecoder.decodeComponent(
                        path.substring(SESSIONS_PREFIX.length(), path.length() - HISTORY_SUFFIX.length()));
                relay(ctx, keepAlive, "chat.history", bridge.history(key));
            } else {
                respond(ctx, keepAlive, HttpResponseStatus.NOT_FOUND, JsonMessages.error("Not found: " + path));
            }
        } catch (JsonProcessingException e) {
            respond(ctx, keepAlive, HttpResponseStatus.BAD_REQUEST, JsonMessages.error("Bad JSON: " + e.getOriginalMessage()));
        }
    }

    // ── Endpoints ────────────────────────────────────────────────────────────

    private void handleSend(ChannelHandlerContext ctx, boolean keepAlive, JsonNode body) {
        String message = JsonMessages.text(body, "message");
        if (message == null) {
            respond(ctx, keepAlive, HttpResponseStatus.BAD_REQUEST, JsonMessages.error("No message"));
            return;
        }
        ChatSubmission submission = bridge.sendChat(message, JsonMessages.text(body, "sessionKey"));
        if (submission.isRejected()) {
            respond(ctx, keepAlive, HttpResponseStatus.SERVICE_UNAVAILABLE, JsonMessages.error("Gateway not connected"));
            return;
        }
        respond(ctx, keepAlive, HttpResponseStatus.OK, JsonMessages.taskAccepted(submission.taskId()));
    }

    private void handleChat(ChannelHandlerContext ctx, boolean keepAlive, JsonNode body) {
        String message = JsonMessages.text(body, "message");
        if (message == null) {
            respond(ctx, keepAlive, HttpResponseStatus.BAD_REQUEST, JsonMessages.error("No message"));
            return;
        }
        ChatSubmission submission = bridge.sendChat(message, null);
        submission.ack().whenComplete((ack, err) -> {
            if (err != null) {
                fail(ctx, keepAlive, "chat.send", err);
            } else {
                respond(ctx, keepAlive, HttpResponseStatus.OK, JsonMessages.chatAck(ack, submission.taskId()));
            }
        });
    }

    private void relay(ChannelHandlerContext ctx, boolean keepAlive, String what, CompletableFuture<JsonNode> result) {
        result.whenComplete((payload, err) -> {
            if (err != null) {
                fail(ctx, keepAlive, what, err);
            } else {
                respond(ctx, keepAlive, HttpResponseStatus.OK, JsonMessages.write(payload));
            }
        });
    }

    private void fail(ChannelHandlerContext ctx, boolean keepAlive, String what, Throwable err) {
        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
        if (cause instanceof NotConnectedException) {
            respond(ctx, keepAlive, HttpResponseStatus.SERVICE_UNAVAILABLE, JsonMessages.error(cause.getMessage()));
            return;
        }
        log.error("{} failed: {}", what, cause.getMessage());
        respond(ctx, keepAlive, HttpResponseStatus.INTERNAL_SERVER_ERROR, JsonMessages.error(cause.getMessage()));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static boolean isHistoryPath(String path) {
        return path.startsWith(SESSIONS_PREFIX)
                && path.endsWith(HISTORY_SUFFIX)
                && path.length() > SESSIONS_PREFIX.length() + HISTORY_SUFFIX.length();
    }

    private static JsonNode body(FullHttpRequest req) throws JsonProcessingException {
        return JsonMessages.parse(req.content().toString(StandardCharsets.UTF_8));
    }

    private static void respond(ChannelHandlerContext ctx, boolean keepAlive, HttpResponseStatus status, String json) {
        ByteBuf content = Unpooled.copiedBuffer(json, StandardCharsets.UTF_8);
        FullHttpResponse resp = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, content);
        resp.headers()
            .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
            .setInt(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes())
            .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        if (keepAlive) {
            resp.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(resp);
        } else {
            ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("HTTP error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }
}
