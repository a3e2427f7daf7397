package com.watcherbridge.gateway.device;

/**
 * One queued device command.
 *
 * @param sequence enqueue order, unique per outbox
 * @param text     the serialized message, sent verbatim
 */
public record CommandEnvelope(long sequence, String text) {
}
