package com.voicerelay.common;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RelayConfigTest {

    @Test
    void defaultsMatchGatewayExpectations() {
        RelayConfig cfg = new RelayConfig();
        assertEquals(5_000, cfg.reconnectDelayMillis, "Fixed reconnect delay");
        assertEquals(120, cfg.chatTimeoutSecs);
        assertEquals(15, cfg.queryTimeoutSecs);
        assertEquals(3, cfg.protocolVersion);
        assertEquals("agent:main:", cfg.agentSessionPrefix);
    }

    @Test
    void classpathConfigIsLoadedWhenNoPathGiven() {
        RelayConfig cfg = RelayConfig.load(null);
        assertEquals("voice-relay:main", cfg.sessionKey);
        assertEquals(List.of("operator.read", "operator.write", "operator.admin"), cfg.scopes);
    }

    @Test
    void missingFileFallsBackToClasspath() {
        RelayConfig cfg = RelayConfig.load("/definitely/not/here/relay.yml");
        assertEquals(3001, cfg.httpPort);
    }

    @Test
    void mapOverridesDefaults() {
        RelayConfig cfg = new RelayConfig();
        RelayConfig.applyMap(cfg, Map.of(
                "gatewayUrl", "wss://gw.example.com",
                "reconnectDelayMillis", 250,
                "clientVersion", 2.5,
                "scopes", List.of("operator.read"),
                "chatTimeoutSecs", 30));

        assertEquals("wss://gw.example.com", cfg.gatewayUrl);
        assertEquals(250, cfg.reconnectDelayMillis);
        assertEquals("2.5", cfg.clientVersion);
        assertEquals(List.of("operator.read"), cfg.scopes);
        assertEquals(30, cfg.chatTimeoutSecs);
        assertEquals(15, cfg.queryTimeoutSecs, "Untouched keys keep their default");
    }

    @Test
    void environmentWinsOverFile() {
        RelayConfig cfg = new RelayConfig();
        RelayConfig.applyEnv(cfg, Map.of(
                "GATEWAY_URL", "ws://10.0.0.5:18789",
                "GATEWAY_TOKEN", "secret-token-value",
                "SESSION_KEY", "whisper-voice:ET",
                "BACKEND_PORT", " 4000 ",
                "UNRELATED", "x"));

        assertEquals("ws://10.0.0.5:18789", cfg.gatewayUrl);
        assertEquals("secret-token-value", cfg.gatewayToken);
        assertEquals("whisper-voice:ET", cfg.sessionKey);
        assertEquals(4000, cfg.httpPort);
    }

    @Test
    void blankEnvironmentValuesAreIgnored() {
        RelayConfig cfg = new RelayConfig();
        RelayConfig.applyEnv(cfg, Map.of("GATEWAY_URL", "  "));
        assertEquals("ws://localhost:18789", cfg.gatewayUrl);
    }

    @Test
    void tokenIsMaskedForLogs() {
        RelayConfig cfg = new RelayConfig();
        assertEquals("(not set)", cfg.maskedToken());

        cfg.gatewayToken = "short";
        assertEquals("****", cfg.maskedToken());

        cfg.gatewayToken = "abcd1234567890wxyz";
        assertEquals("abcd...wxyz", cfg.maskedToken());
    }
}
