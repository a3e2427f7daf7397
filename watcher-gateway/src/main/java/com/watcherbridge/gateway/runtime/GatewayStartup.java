package com.watcherbridge.gateway.runtime;

import com.watcherbridge.bus.BusAdapter;
import com.watcherbridge.common.config.WatcherConfig;
import com.watcherbridge.gateway.bridge.ToolBridgeClient;
import com.watcherbridge.gateway.command.BusCommandRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Gateway boot sequence: log level, bus connection and entity registration,
 * command subscription, tool bridge and monitoring.
 * <p>
 * The bus connection is attempted off the lane; an initial failure is
 * retried until it succeeds or the gateway stops. Later drops are handled by
 * the bus client's own reconnect.
 */
@Slf4j
public class GatewayStartup {

    static final String ROOT_PACKAGE = "com.watcherbridge";

    private final WatcherConfig config;
    private final BusAdapter bus;
    private final BusCommandRouter commandRouter;
    private final GatewayLane lane;
    private final ToolBridgeClient toolBridge;
    private final MonitoringScheduler monitoring;
    private final GatewayTimings timings;
    private final LoggingSystem loggingSystem;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "gw-startup");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean busReady;

    /**
     * @param loggingSystem {@code null} to leave log levels untouched
     */
    public GatewayStartup(WatcherConfig config, BusAdapter bus, BusCommandRouter commandRouter,
            GatewayLane lane, ToolBridgeClient toolBridge, MonitoringScheduler monitoring,
            GatewayTimings timings, LoggingSystem loggingSystem) {
        this.config = config;
        this.bus = bus;
        this.commandRouter = commandRouter;
        this.lane = lane;
        this.toolBridge = toolBridge;
        this.monitoring = monitoring;
        this.timings = timings;
        this.loggingSystem = loggingSystem;
    }

    public void start() {
        log.info("watcher bridge starting: ws port {}, http port {}, bus {}:{}",
                config.getWebsocketPort(), config.getHttpPort(), config.getMqttHost(), config.getMqttPort());

        applyLogLevel();

        scheduler.execute(this::connectBus);

        toolBridge.start();

        monitoring.start();
        log.info("watcher bridge started");
    }

    /**
     * Stop pending bus connection attempts.
     */
    public void stop() {
        scheduler.shutdownNow();
    }

    public boolean isBusReady() {
        return busReady;
    }

    void connectBus() {
        if (bus.connect()) {
            bus.registerEntities();
            bus.publishInitialStates();
            bus.subscribeCommands(commandRouter, lane);
            busReady = true;
            log.info("Bus ready: {} command routes", commandRouter.routes().size());
            return;
        }
        log.warn("Bus connection failed, retrying in {} s", timings.busRetry().toSeconds());
        try {
            scheduler.schedule(this::connectBus, timings.busRetry().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Startup scheduler stopped, not retrying bus connection");
        }
    }

    private void applyLogLevel() {
        if (loggingSystem == null) {
            return;
        }
        LogLevel level = parseLevel(config.getLogLevel());
        if (level == null) {
            log.warn("Unknown log_level '{}', keeping defaults", config.getLogLevel());
            return;
        }
        loggingSystem.setLogLevel(ROOT_PACKAGE, level);
        log.info("Log level for {} set to {}", ROOT_PACKAGE, level);
    }

    static LogLevel parseLevel(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "WARNING":
                return LogLevel.WARN;
            case "CRITICAL":
            case "FATAL":
                return LogLevel.ERROR;
            default:
                try {
                    return LogLevel.valueOf(normalized);
                } catch (IllegalArgumentException e) {
                    return null;
                }
        }
    }
}
