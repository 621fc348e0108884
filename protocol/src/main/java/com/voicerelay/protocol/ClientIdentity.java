package com.voicerelay.protocol;

/**
 * The {@code client} block of the connect handshake.
 */
public record ClientIdentity(String id, String version, String platform, String mode) {
}
