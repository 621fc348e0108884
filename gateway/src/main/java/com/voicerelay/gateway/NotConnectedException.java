package com.voicerelay.gateway;

/**
 * A call was attempted while the gateway connection was not authenticated.
 * Nothing was registered or written.
 */
public final class NotConnectedException extends GatewayException {

    public NotConnectedException() {
        super("Gateway not connected");
    }
}
