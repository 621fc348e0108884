package com.voicerelay.bridge;

import com.voicerelay.common.RelayConfig;
import com.voicerelay.gateway.GatewaySession;
import io.netty.channel.nio.NioEventLoopGroup;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Voice relay backend.
 *
 * Browser (HTTP + /ws push) ──► BridgeMain ──► agent gateway (one WebSocket, JSON frames)
 *
 * Usage:
 *   java -jar ui-bridge.jar [relay-config-path]
 *
 * Defaults: gateway at ws://localhost:18789, HTTP on http://localhost:3001
 */
public final class BridgeMain {

    private static final Logger log = LoggerFactory.getLogger(BridgeMain.class);

    public static void main(String[] args) throws Exception {
        String configPath = args.length > 0 ? args[0] : null;
        RelayConfig cfg = RelayConfig.load(configPath);

        log.info("Starting voice relay: http://localhost:{} → gateway {}", cfg.httpPort, cfg.gatewayUrl);

        // Single loop for the gateway connection: inbound frames are handled one at a time
        NioEventLoopGroup gatewayLoop = new NioEventLoopGroup(1);
        NioEventLoopGroup bossGroup   = new NioEventLoopGroup(1);
        NioEventLoopGroup workerGroup = new NioEventLoopGroup(4);

        GatewaySession session = new GatewaySession(cfg, gatewayLoop);
        session.start();

        RelayHttpServer server = new RelayHttpServer(cfg.httpPort, session, bossGroup, workerGroup);
        server.start();

        log.info("Relay UP. Ctrl-C to stop.");
        new ShutdownSignalBarrier().await();

        server.stop();
        session.close();
        workerGroup.shutdownGracefully();
        bossGroup.shutdownGracefully();
        gatewayLoop.shutdownGracefully();
        log.info("Relay stopped.");
    }
}
