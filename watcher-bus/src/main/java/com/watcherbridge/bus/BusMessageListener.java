package com.watcherbridge.bus;

@FunctionalInterface
public interface BusMessageListener {

    /** Invoked on the client's delivery thread; implementations must hand work off. */
    void onMessage(String topic, byte[] payload);
}
