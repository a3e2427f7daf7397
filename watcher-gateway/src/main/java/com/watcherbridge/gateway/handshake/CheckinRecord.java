package com.watcherbridge.gateway.handshake;

import java.time.Instant;

/**
 * Last device check-in as seen by the handshake endpoint.
 *
 * @param mac     normalized MAC (lower case, no separators) or {@code unknown}
 * @param version firmware version reported by the device
 * @param ip      device address, from the body or the request peer
 * @param at      time of the check-in
 */
public record CheckinRecord(String mac, String version, String ip, Instant at) {
}
