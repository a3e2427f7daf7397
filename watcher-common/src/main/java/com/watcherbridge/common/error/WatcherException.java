package com.watcherbridge.common.error;

/**
 * Base type for every failure the gateway raises on purpose.
 * Subclasses carry the handling policy: transport failures are retried,
 * protocol failures drop one message, collaborator failures are reported
 * or defaulted, config failures stop startup.
 */
public class WatcherException extends RuntimeException {

    public WatcherException(String message) {
        super(message);
    }

    public WatcherException(String message, Throwable cause) {
        super(message, cause);
    }
}
