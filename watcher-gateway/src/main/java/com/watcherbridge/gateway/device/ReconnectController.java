package com.watcherbridge.gateway.device;

import com.watcherbridge.bus.BusAdapter;
import com.watcherbridge.common.infra.Backoff;
import lombok.extern.slf4j.Slf4j;

/**
 * Tracks device connectivity: mirrors it on the bus and keeps the backoff
 * delay the device is expected to honour before redialling. Holds no timers.
 */
@Slf4j
public class ReconnectController {

    private final BusAdapter bus;
    private final Backoff.Policy policy;

    private volatile int consecutiveFailures;
    private volatile long currentDelayMs;

    public ReconnectController(BusAdapter bus) {
        this(bus, Backoff.Policy.DEVICE_RECONNECT);
    }

    public ReconnectController(BusAdapter bus, Backoff.Policy policy) {
        this.bus = bus;
        this.policy = policy;
        this.currentDelayMs = policy.initialMs();
    }

    /**
     * Session became active: reset the delay, publish {@code connected=ON}, then flush.
     */
    public void onConnected(Runnable flushOutbox) {
        consecutiveFailures = 0;
        currentDelayMs = policy.initialMs();
        bus.publishState("binary_sensor/connected", "ON");
        flushOutbox.run();
    }

    /**
     * Current session closed: publish {@code connected=OFF} and grow the delay.
     */
    public void onDisconnected() {
        bus.publishState("binary_sensor/connected", "OFF");
        consecutiveFailures++;
        // attempt 1 is the initial delay, so the first failure already doubles it
        currentDelayMs = Backoff.compute(policy, consecutiveFailures + 1);
        log.info("Device disconnected. Next reconnect delay: {}s", currentDelayMs / 1000.0);
    }

    public long getCurrentDelayMs() {
        return currentDelayMs;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
