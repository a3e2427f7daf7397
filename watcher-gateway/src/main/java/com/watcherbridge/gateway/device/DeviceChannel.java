package com.watcherbridge.gateway.device;

import com.watcherbridge.common.error.TransportException;

/**
 * Transport handle of one device connection.
 */
public interface DeviceChannel {

    /** Transport-level id, stable for the life of the connection. */
    String id();

    /**
     * @throws TransportException when the frame could not be written
     */
    void sendText(String text);

    boolean isOpen();

    /** Close without throwing. */
    void close();

    /**
     * @return the local address the device dialled, or {@code null} if unknown
     */
    String localHost();
}
