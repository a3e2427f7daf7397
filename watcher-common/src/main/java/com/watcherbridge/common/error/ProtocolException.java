package com.watcherbridge.common.error;

/**
 * Malformed or unexpected message. The message is dropped, the session continues.
 */
public class ProtocolException extends WatcherException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
