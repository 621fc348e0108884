package com.voicerelay.protocol;

/**
 * A well-formed frame the relay has no handler for (an event name or an
 * inbound request it does not know). Callers normally drop these quietly.
 */
public final class UnsupportedFrameException extends FrameDecodingException {

    public UnsupportedFrameException(String message) {
        super(message);
    }
}
