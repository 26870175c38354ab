package com.rtmbot.core.identity;

/**
 * Thrown when a name or id has never been observed on the current connection.
 */
public class UnknownIdentityException extends RuntimeException {

    public UnknownIdentityException(String kind, String key) {
        super("Unknown " + kind + ": " + key);
    }
}
