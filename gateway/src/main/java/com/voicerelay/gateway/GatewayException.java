package com.voicerelay.gateway;

/**
 * Base type for failures surfaced to a single caller of the gateway session.
 * Transport and authentication failures never reach callers; they are handled
 * by the connection supervisor.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
