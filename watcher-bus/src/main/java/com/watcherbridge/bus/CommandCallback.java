package com.watcherbridge.bus;

/**
 * Receiver of bus commands, resolved from {@code <node>/<component>/<object>/set}.
 */
@FunctionalInterface
public interface CommandCallback {

    void onCommand(String component, String objectId, String payload);
}
