package com.voicerelay.gateway.session;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Derives the conversation key sent with every turn.
 *
 *   generation 0 → base
 *   generation n → base:n
 *
 * Only {@link #reset()} changes the generation. The gateway reports session
 * keys back in canonical form, {@code <agentPrefix><lower-cased key>}.
 */
public final class SessionKeyspace {

    private final String        baseKey;
    private final String        agentPrefix;
    private final AtomicInteger generation = new AtomicInteger();

    public SessionKeyspace(String baseKey, String agentPrefix) {
        this.baseKey     = baseKey;
        this.agentPrefix = agentPrefix;
    }

    public String current() {
        return keyFor(generation.get());
    }

    public int generation() {
        return generation.get();
    }

    /** Start a new conversation and return its key. */
    public String reset() {
        return keyFor(generation.incrementAndGet());
    }

    /** Key as the gateway echoes it back on agent events. */
    public String canonical(String key) {
        return agentPrefix + key.toLowerCase(Locale.ROOT);
    }

    /** True when an event's session key belongs to the current generation. */
    public boolean matches(String eventSessionKey) {
        if (eventSessionKey == null) return false;
        String current = current();
        return eventSessionKey.equals(canonical(current)) || eventSessionKey.equals(current);
    }

    private String keyFor(int n) {
        return n == 0 ? baseKey : baseKey + ":" + n;
    }
}
