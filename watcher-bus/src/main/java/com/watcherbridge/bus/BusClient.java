package com.watcherbridge.bus;

import com.watcherbridge.common.error.TransportException;

/**
 * Minimal publish/subscribe client for the automation bus.
 */
public interface BusClient {

    /**
     * Connect, registering {@code will} as the broker-side last will.
     *
     * @throws TransportException when the broker cannot be reached within the connect timeout
     */
    void connect(LastWill will);

    /**
     * @throws TransportException when the publish could not be handed to the broker
     */
    void publish(String topic, byte[] payload, boolean retain);

    /**
     * Subscribe now and again after every automatic reconnect.
     */
    void subscribe(String topicFilter, BusMessageListener listener);

    void disconnect();

    boolean isConnected();

    /** Retained message the broker publishes when the client drops without a clean disconnect. */
    record LastWill(String topic, String payload, boolean retain) {
    }
}
