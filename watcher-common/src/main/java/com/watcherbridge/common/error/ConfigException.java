package com.watcherbridge.common.error;

/**
 * Configuration that cannot be repaired with a default. Fatal at startup.
 */
public class ConfigException extends WatcherException {

    public ConfigException(String message) {
        super(message);
    }
}
