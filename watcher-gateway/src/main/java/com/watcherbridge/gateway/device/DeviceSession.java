package com.watcherbridge.gateway.device;

import lombok.Getter;

import java.time.Instant;

/**
 * The device connection occupying the session slot. Mutated only on the gateway lane.
 */
@Getter
public class DeviceSession {

    private final DeviceChannel channel;
    private final Instant connectedAt;
    private volatile String sessionId;
    private volatile DeviceSessionState state = DeviceSessionState.CONNECTING;

    DeviceSession(DeviceChannel channel, Instant connectedAt) {
        this.channel = channel;
        this.connectedAt = connectedAt;
    }

    void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    void setState(DeviceSessionState state) {
        this.state = state;
    }

    boolean isActive() {
        return state == DeviceSessionState.ACTIVE;
    }
}
