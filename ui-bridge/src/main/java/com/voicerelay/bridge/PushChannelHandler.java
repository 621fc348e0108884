package com.voicerelay.bridge;

import com.voicerelay.gateway.GatewayBridge;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One instance per browser WebSocket connection on /ws.
 *
 * Lifecycle:
 *   handshake complete → send {"type":"connected"}, subscribe to results
 *   channelInactive    → unsubscribe
 *
 * The push channel is one-way; inbound frames from the browser are ignored.
 */
final class PushChannelHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(PushChannelHandler.class);

    private final GatewayBridge bridge;

    private long handle = -1;

    PushChannelHandler(GatewayBridge bridge) {
        this.bridge = bridge;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            open(ctx);
        }
        super.userEventTriggered(ctx, evt);
    }

    void open(ChannelHandlerContext ctx) {
        if (handle >= 0) return;
        ctx.writeAndFlush(new TextWebSocketFrame(JsonMessages.connected()));
        handle = bridge.subscribe(new ChannelBroadcastListener(ctx.channel()));
        log.info("Push client connected: {} (handle {}, {} total)",
                ctx.channel().remoteAddress(), handle, bridge.subscriberCount());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (handle >= 0) {
            bridge.unsubscribe(handle);
            log.info("Push client disconnected: handle {}", handle);
            handle = -1;
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Push channel error (handle {}): {}", handle, cause.getMessage());
        ctx.close();
    }

    // ── Message handling ──────────────────────────────────────────────────────

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (frame instanceof TextWebSocketFrame text) {
            log.debug("Ignoring browser frame on push channel: {}", text.text());
        }
    }

    long handle() {
        return handle;
    }
}
