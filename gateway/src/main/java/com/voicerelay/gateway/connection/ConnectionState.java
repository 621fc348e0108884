package com.voicerelay.gateway.connection;

/**
 * DISCONNECTED → CONNECTING → AWAITING_CHALLENGE → AUTHENTICATED → (any fault) DISCONNECTED
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    AWAITING_CHALLENGE,
    AUTHENTICATED
}
