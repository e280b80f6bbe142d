package com.respkv.network.protocol;

/**
 * Exception thrown when a frame is malformed and the connection must be dropped.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
