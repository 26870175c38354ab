package com.rtmbot.core.transport;

/**
 * The remote service sent something the protocol does not allow, such as a
 * reply missing a required field.
 */
public class ProtocolViolationException extends RuntimeException {

    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
