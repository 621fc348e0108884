package com.voicerelay.protocol;

/**
 * Raised when an inbound text frame is not valid JSON or does not have the
 * shape its {@code type} requires.
 */
public class FrameDecodingException extends Exception {

    public FrameDecodingException(String message) {
        super(message);
    }

    public FrameDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
