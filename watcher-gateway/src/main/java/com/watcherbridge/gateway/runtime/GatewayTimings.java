package com.watcherbridge.gateway.runtime;

import java.time.Duration;

/**
 * Delays the gateway schedules on its lane.
 *
 * @param listenStopDelay pause between a device {@code listen} and the {@code tts stop} reply
 * @param flushPacing     gap between consecutive outbox deliveries
 * @param bridgeRetry     wait before redialling the tool broker
 * @param bridgePing      WebSocket ping period on the tool broker connection
 * @param busRetry        wait before retrying an initial bus connection
 */
public record GatewayTimings(Duration listenStopDelay, Duration flushPacing,
        Duration bridgeRetry, Duration bridgePing, Duration busRetry) {

    public static final GatewayTimings DEFAULT = new GatewayTimings(
            Duration.ofMillis(500),
            Duration.ofMillis(100),
            Duration.ofSeconds(10),
            Duration.ofSeconds(30),
            Duration.ofSeconds(10));
}
