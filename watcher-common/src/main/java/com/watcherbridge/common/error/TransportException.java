package com.watcherbridge.common.error;

/**
 * Socket, bus or HTTP failure. Retried with backoff, never fatal to the process.
 */
public class TransportException extends WatcherException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
