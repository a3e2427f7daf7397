package com.watcherbridge.gateway.runtime;

import com.watcherbridge.common.config.WatcherConfig;
import com.watcherbridge.gateway.device.DeviceCommands;
import com.watcherbridge.gateway.device.DeviceSessionManager;
import com.watcherbridge.perception.PerceptionPipeline;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic frame requests while monitoring is switched on.
 * <p>
 * Ticks on the gateway lane; the period is re-read from
 * {@code monitoring_interval} before each wait, so bus changes take effect on
 * the next cycle. Requests go out only to an active session and are never
 * queued for an offline device.
 */
@Slf4j
public class MonitoringScheduler {

    private final GatewayLane lane;
    private final DeviceSessionManager devices;
    private final DeviceCommands commands;
    private final PerceptionPipeline perception;
    private final WatcherConfig config;

    private volatile boolean running;
    private volatile ScheduledFuture<?> next;

    public MonitoringScheduler(GatewayLane lane, DeviceSessionManager devices, DeviceCommands commands,
            PerceptionPipeline perception, WatcherConfig config) {
        this.lane = lane;
        this.devices = devices;
        this.commands = commands;
        this.perception = perception;
        this.config = config;
    }

    public void start() {
        if (running) {
            return;
        }
        running = true;
        log.info("Monitoring scheduler started (interval {} s)", config.getMonitoringInterval());
        scheduleNext();
    }

    public void stop() {
        running = false;
        ScheduledFuture<?> pending = next;
        if (pending != null) {
            pending.cancel(false);
        }
    }

    public boolean isRunning() {
        return running;
    }

    void tick() {
        if (!running) {
            return;
        }
        if (perception.isMonitoringEnabled()) {
            if (devices.sendIfActive(commands.requestFrame())) {
                log.debug("Monitoring: requested frame");
            } else {
                log.debug("Monitoring: device not active, skipping frame request");
            }
        }
        scheduleNext();
    }

    private void scheduleNext() {
        if (running) {
            next = lane.schedule(this::tick, Duration.ofSeconds(config.getMonitoringInterval()));
        }
    }
}
