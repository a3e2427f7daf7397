package com.watcherbridge.gateway.runtime;

import com.watcherbridge.bus.BusAdapter;
import com.watcherbridge.gateway.bridge.ToolBridgeClient;
import com.watcherbridge.gateway.device.DeviceSessionManager;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Orderly gateway shutdown. Every step runs even when an earlier one fails:
 * <ol>
 * <li>stop monitoring and pending startup work</li>
 * <li>stop the tool bridge</li>
 * <li>close the device socket</li>
 * <li>publish {@code connected=OFF} and disconnect the bus</li>
 * <li>stop the lane and the collaborator executor</li>
 * <li>close collaborators that hold resources</li>
 * </ol>
 */
@Slf4j
public class GatewayShutdown {

    private static final long CLOSE_TIMEOUT_SECONDS = 2;

    private final MonitoringScheduler monitoring;
    private final GatewayStartup startup;
    private final ToolBridgeClient toolBridge;
    private final DeviceSessionManager devices;
    private final BusAdapter bus;
    private final GatewayLane lane;
    private final ExecutorService collaboratorExecutor;
    private final List<?> collaborators;

    private volatile boolean done;

    public GatewayShutdown(MonitoringScheduler monitoring, GatewayStartup startup, ToolBridgeClient toolBridge,
            DeviceSessionManager devices, BusAdapter bus, GatewayLane lane,
            ExecutorService collaboratorExecutor, List<?> collaborators) {
        this.monitoring = monitoring;
        this.startup = startup;
        this.toolBridge = toolBridge;
        this.devices = devices;
        this.bus = bus;
        this.lane = lane;
        this.collaboratorExecutor = collaboratorExecutor;
        this.collaborators = collaborators;
    }

    public synchronized void shutdown() {
        if (done) {
            return;
        }
        done = true;
        log.info("watcher bridge shutting down");

        step("stop monitoring", () -> {
            monitoring.stop();
            startup.stop();
        });
        step("stop tool bridge", toolBridge::stop);
        step("close device socket",
                () -> devices.closeCurrent().get(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS));
        step("disconnect bus", bus::disconnect);
        step("stop lane", lane::shutdown);
        step("stop collaborator executor", () -> {
            collaboratorExecutor.shutdown();
            if (!collaboratorExecutor.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                collaboratorExecutor.shutdownNow();
            }
        });
        for (Object collaborator : collaborators) {
            if (collaborator instanceof AutoCloseable closeable) {
                step("close " + collaborator.getClass().getSimpleName(), closeable::close);
            }
        }

        log.info("watcher bridge shutdown complete");
    }

    public boolean isDone() {
        return done;
    }

    @FunctionalInterface
    private interface Step {
        void run() throws Exception;
    }

    private static void step(String name, Step step) {
        try {
            step.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("shutdown: {} interrupted", name);
        } catch (Exception e) {
            log.warn("shutdown: error during {}: {}", name, e.getMessage());
        }
    }
}
