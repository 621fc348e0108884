package com.voicerelay.gateway.connection;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler.ClientHandshakeStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last handler of the gateway WebSocket pipeline.
 *
 * Translates channel events into supervisor callbacks:
 *   HANDSHAKE_COMPLETE → transport open (await challenge)
 *   text frame         → decode + dispatch
 *   channelInactive    → disconnect + scheduled reconnect
 *
 * One instance per channel, NOT @Sharable.
 */
final class GatewayClientHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(GatewayClientHandler.class);

    private final ConnectionSupervisor supervisor;

    GatewayClientHandler(ConnectionSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        supervisor.onChannelConnected(ctx.channel());
        super.channelActive(ctx);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt == ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
            supervisor.onTransportOpen(ctx.channel());
        } else if (evt == ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
            log.warn("WebSocket upgrade to gateway timed out");
            ctx.close();
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        supervisor.onText(ctx.channel(), frame.text());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        supervisor.onTransportClosed(ctx.channel(), "connection closed");
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Gateway connection error: {}", cause.getMessage());
        supervisor.recordFailure(cause.getMessage());
        ctx.close();
    }
}
