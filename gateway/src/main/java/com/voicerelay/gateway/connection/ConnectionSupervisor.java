package com.voicerelay.gateway.connection;

import com.voicerelay.common.RelayConfig;
import com.voicerelay.gateway.NotConnectedException;
import com.voicerelay.protocol.ChallengeFrame;
import com.voicerelay.protocol.ClientIdentity;
import com.voicerelay.protocol.ConnectParams;
import com.voicerelay.protocol.FrameCodec;
import com.voicerelay.protocol.FrameDecodingException;
import com.voicerelay.protocol.GatewayFrame;
import com.voicerelay.protocol.HeartbeatFrame;
import com.voicerelay.protocol.RequestFrame;
import com.voicerelay.protocol.ResponseFrame;
import com.voicerelay.protocol.UnsupportedFrameException;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the single WebSocket connection from the relay to the agent gateway.
 *
 * Pipeline (per attempt, fresh handshaker each time):
 *   [SslHandler]  (wss only)
 *   → HttpClientCodec
 *   → HttpObjectAggregator
 *   → WebSocketClientProtocolHandler (upgrade with Authorization: Bearer, ping/pong, close)
 *   → WebSocketFrameAggregator       (continuation frames → one text frame)
 *   → GatewayClientHandler
 *
 * State machine:
 *   DISCONNECTED → CONNECTING → AWAITING_CHALLENGE → AUTHENTICATED
 *   any close/error → DISCONNECTED, reconnect after a fixed delay (no backoff).
 *
 * A rejected connect handshake is treated like any transport failure: the
 * socket is closed and the reconnect loop retries indefinitely.
 *
 * All channels are registered on the supplied group; give it a single event
 * loop so inbound frames are processed strictly one at a time.
 *
 * Disconnects never fail pending requests; those run out on their own deadlines.
 */
public final class ConnectionSupervisor implements GatewayTransport {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private static final int HTTP_AGGREGATE_LIMIT = 65536;
    private static final int LOG_PREVIEW_CHARS    = 500;

    private final RelayConfig     cfg;
    private final EventLoopGroup  group;
    private final FrameCodec      codec;
    private final FrameListener   listener;
    private final URI             uri;

    private final Object     stateLock  = new Object();
    private final AtomicLong attemptSeq = new AtomicLong();

    // Guarded by stateLock; volatile for the lock-free reads on the write path
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Channel         channel;
    private volatile String          lastFailure;
    private String                   handshakeRequestId;
    private String                   closeCause;
    private ScheduledFuture<?>       reconnectTask;
    private boolean                  stopped;

    public ConnectionSupervisor(RelayConfig cfg, EventLoopGroup group, FrameCodec codec, FrameListener listener) {
        this.cfg      = cfg;
        this.group    = group;
        this.codec    = codec;
        this.listener = listener;
        this.uri      = URI.create(cfg.gatewayUrl);
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    @Override
    public void connect() {
        if (!beginAttempt()) return;

        log.info("Connecting to gateway at {} (token {})", uri, cfg.maskedToken());
        ChannelFuture future;
        try {
            future = bootstrap().connect(host(), port());
        } catch (Exception e) {
            onTransportClosed(null, "connect failed: " + e.getMessage());
            return;
        }
        // On success GatewayClientHandler.channelActive registers the channel
        future.addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                log.error("Failed to connect to gateway {}: {}", uri, f.cause().getMessage());
                onTransportClosed(null, "connect failed: " + f.cause().getMessage());
            }
        });
    }

    /** Moves DISCONNECTED → CONNECTING; false if an attempt is already running or the link is up. */
    boolean beginAttempt() {
        synchronized (stateLock) {
            if (stopped) return false;
            if (state != ConnectionState.DISCONNECTED) {
                log.debug("connect() ignored, state={}", state);
                return false;
            }
            state = ConnectionState.CONNECTING;
            reconnectTask = null;
            closeCause = null;
            return true;
        }
    }

    @Override
    public void stop() {
        Channel ch;
        synchronized (stateLock) {
            stopped = true;
            if (reconnectTask != null) {
                reconnectTask.cancel(false);
                reconnectTask = null;
            }
            ch = channel;
            channel = null;
            handshakeRequestId = null;
            state = ConnectionState.DISCONNECTED;
        }
        if (ch != null) ch.close();
        log.info("Gateway connection stopped");
    }

    private Bootstrap bootstrap() throws SSLException {
        boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
        SslContext sslCtx = secure ? SslContextBuilder.forClient().build() : null;
        String host = host();
        int port = port();

        return new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (sslCtx != null) p.addLast(sslCtx.newHandler(ch.alloc(), host, port));
                        p.addLast(new HttpClientCodec())
                         .addLast(new HttpObjectAggregator(HTTP_AGGREGATE_LIMIT))
                         .addLast(new WebSocketClientProtocolHandler(newHandshaker()))
                         .addLast(new WebSocketFrameAggregator(cfg.maxFramePayload))
                         .addLast(new GatewayClientHandler(ConnectionSupervisor.this));
                    }
                });
    }

    private WebSocketClientHandshaker newHandshaker() {
        HttpHeaders headers = new DefaultHttpHeaders()
                .set(HttpHeaderNames.AUTHORIZATION, "Bearer " + cfg.gatewayToken);
        return WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, true, headers, cfg.maxFramePayload);
    }

    private String host() {
        return uri.getHost() != null ? uri.getHost() : "localhost";
    }

    private int port() {
        if (uri.getPort() != -1) return uri.getPort();
        return "wss".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    // ── Channel callbacks (event loop) ───────────────────────────────────────

    void onChannelConnected(Channel ch) {
        synchronized (stateLock) {
            if (state != ConnectionState.CONNECTING) return;
            channel = ch;
        }
    }

    void onTransportOpen(Channel ch) {
        synchronized (stateLock) {
            if (state != ConnectionState.CONNECTING) {
                log.warn("Transport opened in unexpected state {}", state);
                return;
            }
            channel = ch;
            state = ConnectionState.AWAITING_CHALLENGE;
        }
        log.info("Connected to gateway {}, awaiting challenge", uri);
    }

    void onText(Channel ch, String text) {
        GatewayFrame frame;
        try {
            frame = codec.decode(text);
        } catch (UnsupportedFrameException e) {
            log.debug("Ignoring gateway frame: {}", e.getMessage());
            return;
        } catch (FrameDecodingException e) {
            log.warn("Undecodable gateway frame: {}", e.getMessage());
            return;
        }
        onFrame(ch, frame);
    }

    void onFrame(Channel ch, GatewayFrame frame) {
        if (frame instanceof HeartbeatFrame) return;

        if (frame instanceof ChallengeFrame challenge) {
            answerChallenge(ch, challenge);
            return;
        }

        if (frame instanceof ResponseFrame res && isHandshakeResponse(res)) {
            completeHandshake(ch, res);
            return;
        }

        if (state != ConnectionState.AUTHENTICATED) {
            log.debug("Dropping {} frame received before authentication", frame.type());
            return;
        }
        listener.onFrame(frame);
    }

    void onTransportClosed(Channel ch, String reason) {
        synchronized (stateLock) {
            if (state == ConnectionState.DISCONNECTED) return;
            if (ch != null && channel != null && ch != channel) return;

            ConnectionState previous = state;
            channel = null;
            handshakeRequestId = null;
            state = ConnectionState.DISCONNECTED;
            lastFailure = closeCause != null ? closeCause : reason;
            closeCause = null;

            if (stopped) return;
            log.warn("Gateway disconnected from state {} ({}), reconnecting in {}ms",
                    previous, lastFailure, cfg.reconnectDelayMillis);
            reconnectTask = group.schedule(this::connect, cfg.reconnectDelayMillis, TimeUnit.MILLISECONDS);
        }
    }

    /** Reason reported for the next close; the first one recorded wins. */
    void recordFailure(String reason) {
        synchronized (stateLock) {
            if (closeCause == null) closeCause = reason;
        }
    }

    // ── Handshake ────────────────────────────────────────────────────────────

    private void answerChallenge(Channel ch, ChallengeFrame challenge) {
        RequestFrame connect;
        synchronized (stateLock) {
            if (state != ConnectionState.AWAITING_CHALLENGE || ch != channel) {
                log.debug("Ignoring challenge in state {}", state);
                return;
            }
            connect = codec.connectRequest("connect_" + attemptSeq.incrementAndGet(), connectParams());
            handshakeRequestId = connect.id();
        }
        log.debug("Answering gateway challenge (nonce {}) with {}", challenge.nonce(), connect.id());
        ch.writeAndFlush(new TextWebSocketFrame(codec.encode(connect)));
    }

    private ConnectParams connectParams() {
        return new ConnectParams(
                cfg.protocolVersion,
                cfg.protocolVersion,
                new ClientIdentity(cfg.clientId, cfg.clientVersion, cfg.clientPlatform, cfg.clientMode),
                cfg.role,
                List.copyOf(cfg.scopes),
                List.of(),
                new ConnectParams.Auth(cfg.gatewayToken));
    }

    private boolean isHandshakeResponse(ResponseFrame res) {
        synchronized (stateLock) {
            return handshakeRequestId != null && handshakeRequestId.equals(res.id());
        }
    }

    private void completeHandshake(Channel ch, ResponseFrame res) {
        if (res.isError()) {
            log.error("Gateway rejected connect handshake: {}", res.errorMessage());
            recordFailure("auth rejected: " + res.errorMessage());
            ch.close();
            return;
        }
        synchronized (stateLock) {
            if (ch != channel) return;
            handshakeRequestId = null;
            state = ConnectionState.AUTHENTICATED;
            lastFailure = null;
            closeCause = null;
        }
        String hello = res.payload() != null ? res.payload().toString() : "{}";
        log.info("Gateway handshake complete: {}",
                hello.length() > LOG_PREVIEW_CHARS ? hello.substring(0, LOG_PREVIEW_CHARS) : hello);
    }

    // ── Transport ────────────────────────────────────────────────────────────

    @Override
    public boolean isAuthenticated() {
        Channel ch = channel;
        return state == ConnectionState.AUTHENTICATED && ch != null && ch.isActive();
    }

    @Override
    public void write(RequestFrame frame) {
        Channel ch = channel;
        if (state != ConnectionState.AUTHENTICATED || ch == null || !ch.isActive()) {
            throw new NotConnectedException();
        }
        ch.writeAndFlush(new TextWebSocketFrame(codec.encode(frame))).addListener(f -> {
            if (!f.isSuccess()) {
                log.warn("Failed to write {} {}: {}", frame.method().wire, frame.id(), f.cause().getMessage());
            }
        });
    }

    public ConnectionState state() {
        return state;
    }

    public String lastFailure() {
        return lastFailure;
    }

    boolean reconnectPending() {
        synchronized (stateLock) {
            return reconnectTask != null && !reconnectTask.isDone();
        }
    }
}
