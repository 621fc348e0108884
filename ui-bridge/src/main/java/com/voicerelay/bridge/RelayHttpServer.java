package com.voicerelay.bridge;

import com.voicerelay.gateway.GatewayBridge;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Netty HTTP server for the browser: JSON API plus the /ws push channel.
 *
 * Pipeline per connection:
 *   HttpServerCodec
 *   → HttpObjectAggregator          (reassemble HTTP requests)
 *   → CorsHandler                   (answer preflight)
 *   → WebSocketServerCompressionHandler
 *   → WebSocketServerProtocolHandler (upgrades GET /ws, ping/pong; other paths pass through)
 *   → ApiHandler                    (/api/*)
 *   → PushChannelHandler            (result push on /ws)
 */
public final class RelayHttpServer {

    private static final Logger log = LoggerFactory.getLogger(RelayHttpServer.class);
    private static final String WS_PATH = "/ws";
    private static final int    MAX_REQUEST_BYTES = 1024 * 1024;

    private final int               port;
    private final GatewayBridge     bridge;
    private final NioEventLoopGroup bossGroup;
    private final NioEventLoopGroup workerGroup;

    private Channel serverChannel;

    public RelayHttpServer(int port, GatewayBridge bridge,
                           NioEventLoopGroup bossGroup, NioEventLoopGroup workerGroup) {
        this.port        = port;
        this.bridge      = bridge;
        this.bossGroup   = bossGroup;
        this.workerGroup = workerGroup;
    }

    public void start() throws InterruptedException {
        ServerBootstrap b = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new HttpServerCodec())
                                .addLast(new HttpObjectAggregator(MAX_REQUEST_BYTES))
                                .addLast(CorsHandler.INSTANCE)
                                .addLast(new WebSocketServerCompressionHandler())
                                .addLast(new WebSocketServerProtocolHandler(WS_PATH, null, true))
                                .addLast(new ApiHandler(bridge))
                                // One per connection, NOT @Sharable
                                .addLast(new PushChannelHandler(bridge));
                    }
                });

        serverChannel = b.bind(port).sync().channel();
        log.info("Relay HTTP server listening on http://localhost:{} (push on {})", port, WS_PATH);
    }

    public void stop() throws InterruptedException {
        if (serverChannel != null) serverChannel.close().sync();
    }

    /**
     * Minimal CORS handler: answers OPTIONS preflight with
     * Access-Control-Allow-Origin: * so a dev UI on another port can call the API.
     */
    @ChannelHandler.Sharable
    static final class CorsHandler extends ChannelInboundHandlerAdapter {

        static final CorsHandler INSTANCE = new CorsHandler();

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
            if (msg instanceof HttpRequest req && req.method() == HttpMethod.OPTIONS) {
                ReferenceCountUtil.release(msg);
                FullHttpResponse resp = new DefaultFullHttpResponse(
                        HttpVersion.HTTP_1_1, HttpResponseStatus.OK, Unpooled.EMPTY_BUFFER);
                resp.headers()
                        .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*")
                        .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, "*")
                        .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, OPTIONS")
                        .setInt(HttpHeaderNames.CONTENT_LENGTH, 0);
                ctx.writeAndFlush(resp);
                return;
            }
            super.channelRead(ctx, msg);
        }
    }
}
