package com.voicerelay.gateway;

import com.voicerelay.protocol.GatewayMethod;

import java.time.Duration;

public final class RequestTimeoutException extends GatewayException {

    private final String requestId;

    public RequestTimeoutException(GatewayMethod method, String requestId, Duration timeout) {
        super("Gateway timeout: " + method.wire + " " + requestId + " got no response within " + timeout.toMillis() + "ms");
        this.requestId = requestId;
    }

    public String requestId() {
        return requestId;
    }
}
