package com.watcherbridge.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.ToString;

/**
 * Gateway options, read from the add-on options file (snake_case keys).
 * <p>
 * The fields in the "runtime" group are changed by bus commands while the
 * gateway runs; they are written only from the gateway lane and read from
 * anywhere, hence volatile.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WatcherConfig {

    public static final int DEFAULT_WEBSOCKET_PORT = 8000;
    public static final int DEFAULT_HTTP_PORT = 8001;
    public static final String DEFAULT_MQTT_HOST = "core-mosquitto";
    public static final int DEFAULT_MQTT_PORT = 1883;
    public static final int DEFAULT_MONITORING_INTERVAL = 30;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.5;
    public static final double DEFAULT_MOTION_THRESHOLD = 0.05;
    public static final double DEFAULT_NOISE_THRESHOLD = 500;

    // --- Listeners ---

    /** Port the device dials for its WebSocket session. */
    private int websocketPort = DEFAULT_WEBSOCKET_PORT;

    /** Port of the check-in / vision-ingest HTTP endpoints. */
    private int httpPort = DEFAULT_HTTP_PORT;

    /** Address announced to the device; empty means "the address it dialled". */
    private String hostIp = "";

    // --- Bus ---

    private String mqttHost = "";
    private int mqttPort = 0;
    private String mqttUser = "";
    @ToString.Exclude
    private String mqttPassword = "";
    private String discoveryPrefix = "homeassistant";
    private String nodeId = "sensecap_watcher";

    // --- Tool bridge ---

    /** Remote broker URL (ws:// or wss://); empty disables the bridge. */
    private String toolBridgeUrl = "";

    /** Bearer token announced to the device for image uploads. */
    @ToString.Exclude
    private String visionToken = "sensecap-local";

    // --- Runtime ---

    private volatile String customPrompt = "";
    private volatile int monitoringInterval = DEFAULT_MONITORING_INTERVAL;
    private volatile double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
    private volatile boolean voiceAssistant = false;

    // --- Perception ---

    private double motionThreshold = DEFAULT_MOTION_THRESHOLD;
    private double noiseThreshold = DEFAULT_NOISE_THRESHOLD;

    // --- Files ---

    private String snapshotDir = "/share/watcher/snapshots";
    private String dataDir = "/data";
    private String firmwarePath = "/data/firmware.bin";

    private String logLevel = "info";

    public boolean isToolBridgeEnabled() {
        return toolBridgeUrl != null && !toolBridgeUrl.isBlank();
    }
}
