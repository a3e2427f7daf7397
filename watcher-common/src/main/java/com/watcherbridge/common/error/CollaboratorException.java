package com.watcherbridge.common.error;

/**
 * Vision, speech or automation-tool backend failure.
 */
public class CollaboratorException extends WatcherException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
