package com.voicerelay.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration loaded from relay.yml (or classpath default), then
 * overridden by environment variables.
 * All fields have sensible defaults for localhost development.
 */
public final class RelayConfig {

    private static final Logger log = LoggerFactory.getLogger(RelayConfig.class);

    // Upstream gateway
    public String gatewayUrl = "ws://localhost:18789";
    public String gatewayToken = "";
    public int reconnectDelayMillis = 5_000;
    public int maxFramePayload = 10 * 1024 * 1024;

    // Handshake identity
    public int protocolVersion = 3;
    public String clientId = "voice-relay";
    public String clientVersion = "1.0.0";
    public String clientPlatform = "linux";
    public String clientMode = "backend";
    public String role = "operator";
    public List<String> scopes = List.of("operator.read", "operator.write", "operator.admin");

    // Conversation
    public String sessionKey = "voice-relay:main";
    public String agentSessionPrefix = "agent:main:";
    public int chatTimeoutSecs = 120;
    public int queryTimeoutSecs = 15;
    public int historyLimit = 50;
    public int sessionsLimit = 50;

    // Browser-facing HTTP / WS
    public int httpPort = 3001;

    // Metrics
    public int metricsIntervalSecs = 60;

    public static RelayConfig load(String path) {
        RelayConfig cfg = new RelayConfig();
        try {
            InputStream is = path != null && Files.exists(Paths.get(path))
                    ? Files.newInputStream(Paths.get(path))
                    : RelayConfig.class.getResourceAsStream("/relay.yml");
            if (is != null) {
                try (is) {
                    Map<String, Object> map = new Yaml().load(is);
                    if (map != null) applyMap(cfg, map);
                }
            }
        } catch (Exception e) {
            log.warn("Failed to load config, using defaults: {}", e.getMessage());
        }
        applyEnv(cfg, System.getenv());
        return cfg;
    }

    static void applyMap(RelayConfig cfg, Map<String, Object> map) {
        if (map.containsKey("gatewayUrl")) cfg.gatewayUrl = (String) map.get("gatewayUrl");
        if (map.containsKey("gatewayToken")) cfg.gatewayToken = (String) map.get("gatewayToken");
        if (map.containsKey("reconnectDelayMillis")) cfg.reconnectDelayMillis = (int) map.get("reconnectDelayMillis");
        if (map.containsKey("maxFramePayload")) cfg.maxFramePayload = (int) map.get("maxFramePayload");
        if (map.containsKey("protocolVersion")) cfg.protocolVersion = (int) map.get("protocolVersion");
        if (map.containsKey("clientId")) cfg.clientId = (String) map.get("clientId");
        if (map.containsKey("clientVersion")) cfg.clientVersion = String.valueOf(map.get("clientVersion"));
        if (map.containsKey("clientPlatform")) cfg.clientPlatform = (String) map.get("clientPlatform");
        if (map.containsKey("clientMode")) cfg.clientMode = (String) map.get("clientMode");
        if (map.containsKey("role")) cfg.role = (String) map.get("role");
        if (map.containsKey("scopes")) cfg.scopes = toStringList(map.get("scopes"));
        if (map.containsKey("sessionKey")) cfg.sessionKey = (String) map.get("sessionKey");
        if (map.containsKey("agentSessionPrefix")) cfg.agentSessionPrefix = (String) map.get("agentSessionPrefix");
        if (map.containsKey("chatTimeoutSecs")) cfg.chatTimeoutSecs = (int) map.get("chatTimeoutSecs");
        if (map.containsKey("queryTimeoutSecs")) cfg.queryTimeoutSecs = (int) map.get("queryTimeoutSecs");
        if (map.containsKey("historyLimit")) cfg.historyLimit = (int) map.get("historyLimit");
        if (map.containsKey("sessionsLimit")) cfg.sessionsLimit = (int) map.get("sessionsLimit");
        if (map.containsKey("httpPort")) cfg.httpPort = (int) map.get("httpPort");
        if (map.containsKey("metricsIntervalSecs")) cfg.metricsIntervalSecs = (int) map.get("metricsIntervalSecs");
    }

    static void applyEnv(RelayConfig cfg, Map<String, String> env) {
        String v;
        if ((v = env.get("GATEWAY_URL")) != null && !v.isBlank()) cfg.gatewayUrl = v;
        if ((v = env.get("GATEWAY_TOKEN")) != null && !v.isBlank()) cfg.gatewayToken = v;
        if ((v = env.get("SESSION_KEY")) != null && !v.isBlank()) cfg.sessionKey = v;
        if ((v = env.get("BACKEND_PORT")) != null && !v.isBlank()) cfg.httpPort = Integer.parseInt(v.trim());
    }

    /** Token in log-safe form: first and last four characters only. */
    public String maskedToken() {
        if (gatewayToken == null || gatewayToken.isEmpty()) return "(not set)";
        if (gatewayToken.length() <= 8) return "****";
        return gatewayToken.substring(0, 4) + "..." + gatewayToken.substring(gatewayToken.length() - 4);
    }

    private static List<String> toStringList(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object o : list) out.add(String.valueOf(o));
        } else if (value != null) {
            out.add(String.valueOf(value));
        }
        return List.copyOf(out);
    }
}
