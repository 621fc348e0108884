package com.voicerelay.gateway;

import com.voicerelay.protocol.GatewayMethod;

/**
 * The gateway answered a request with an error payload. The message is the
 * upstream text, unchanged.
 */
public final class UpstreamErrorException extends GatewayException {

    private final GatewayMethod method;

    public UpstreamErrorException(GatewayMethod method, String upstreamMessage) {
        super(upstreamMessage);
        this.method = method;
    }

    public GatewayMethod method() {
        return method;
    }
}
