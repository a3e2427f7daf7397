package com.watcherbridge.gateway.device;

public enum DeviceSessionState {
    /** Socket accepted, not yet adopted by the lane. */
    CONNECTING,
    /** Current session, waiting for {@code hello}. */
    HANDSHAKING,
    /** Handshake done; commands may be delivered. */
    ACTIVE,
    CLOSED
}
