package com.watcherbridge.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.watcherbridge.bus.BusAdapter;
import com.watcherbridge.bus.EntityCatalog;
import com.watcherbridge.bus.PahoBusClient;
import com.watcherbridge.common.collab.SpeechProvider;
import com.watcherbridge.common.collab.ToolExecutor;
import com.watcherbridge.common.collab.VisionProvider;
import com.watcherbridge.common.config.ConfigService;
import com.watcherbridge.common.config.WatcherConfig;
import com.watcherbridge.gateway.bridge.ToolBridgeClient;
import com.watcherbridge.gateway.bridge.ToolBridgeDispatcher;
import com.watcherbridge.gateway.command.BusCommandRouter;
import com.watcherbridge.gateway.device.DeviceCommands;
import com.watcherbridge.gateway.device.DeviceMessageParser;
import com.watcherbridge.gateway.device.DeviceSessionManager;
import com.watcherbridge.gateway.device.ReconnectController;
import com.watcherbridge.gateway.runtime.GatewayLane;
import com.watcherbridge.gateway.runtime.GatewayShutdown;
import com.watcherbridge.gateway.runtime.GatewayStartup;
import com.watcherbridge.gateway.runtime.GatewayTimings;
import com.watcherbridge.gateway.runtime.MonitoringScheduler;
import com.watcherbridge.gateway.websocket.DevicePortCustomizer;
import com.watcherbridge.perception.MotionDetector;
import com.watcherbridge.perception.NoiseDetector;
import com.watcherbridge.perception.PerceptionPipeline;
import com.watcherbridge.perception.SceneAnalyzer;
import com.watcherbridge.perception.SnapshotStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for gateway beans. Collaborators
 * ({@link VisionProvider}, {@link SpeechProvider}, {@link ToolExecutor}) are
 * supplied by the application.
 */
@Configuration
public class GatewayBeanConfig {

    private static final int COLLABORATOR_THREADS = 2;

    @Value("${watcher.config.path:/data/options.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(Path.of(configPath));
    }

    @Bean
    public WatcherConfig watcherConfig(ConfigService configService) {
        return configService.load();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GatewayTimings gatewayTimings() {
        return GatewayTimings.DEFAULT;
    }

    @Bean
    public GatewayLane gatewayLane() {
        return new GatewayLane();
    }

    @Bean
    public ExecutorService collaboratorExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(COLLABORATOR_THREADS, r -> {
            Thread t = new Thread(r, "collaborator-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnProperty(name = "watcher.ports.from-options", havingValue = "true", matchIfMissing = true)
    public DevicePortCustomizer devicePortCustomizer(WatcherConfig config) {
        return new DevicePortCustomizer(config);
    }

    // --- Bus ---

    @Bean
    public EntityCatalog entityCatalog(WatcherConfig config) {
        return new EntityCatalog(config.getDiscoveryPrefix(), config.getNodeId());
    }

    @Bean
    public PahoBusClient busClient(WatcherConfig config) {
        return new PahoBusClient(config.getMqttHost(), config.getMqttPort(),
                config.getNodeId() + "_integration", config.getMqttUser(), config.getMqttPassword());
    }

    @Bean
    public BusAdapter busAdapter(PahoBusClient busClient, EntityCatalog catalog, ObjectMapper objectMapper) {
        return new BusAdapter(busClient, catalog, objectMapper);
    }

    // --- Perception ---

    @Bean
    public SnapshotStore snapshotStore(WatcherConfig config, Clock clock) {
        return new SnapshotStore(Path.of(config.getSnapshotDir()), clock);
    }

    @Bean
    public PerceptionPipeline perceptionPipeline(WatcherConfig config, VisionProvider vision,
            SnapshotStore snapshots, Clock clock, ExecutorService collaboratorExecutor) {
        return new PerceptionPipeline(
                new MotionDetector(config.getMotionThreshold()),
                new NoiseDetector(config.getNoiseThreshold()),
                new SceneAnalyzer(vision, snapshots, clock, collaboratorExecutor));
    }

    // --- Device ---

    @Bean
    public DeviceMessageParser deviceMessageParser(ObjectMapper objectMapper) {
        return new DeviceMessageParser(objectMapper);
    }

    @Bean
    public DeviceCommands deviceCommands(ObjectMapper objectMapper) {
        return new DeviceCommands(objectMapper);
    }

    @Bean
    public ReconnectController reconnectController(BusAdapter busAdapter) {
        return new ReconnectController(busAdapter);
    }

    @Bean
    public DeviceSessionManager deviceSessionManager(GatewayLane lane, DeviceMessageParser parser,
            DeviceCommands commands, BusAdapter busAdapter, PerceptionPipeline perception,
            SpeechProvider speech, ExecutorService collaboratorExecutor, ReconnectController reconnect,
            WatcherConfig config, GatewayTimings timings, Clock clock) {
        return new DeviceSessionManager(lane, parser, commands, busAdapter, perception, speech,
                collaboratorExecutor, reconnect, config, timings, clock);
    }

    @Bean
    public BusCommandRouter busCommandRouter(DeviceSessionManager devices, DeviceCommands commands,
            BusAdapter busAdapter, PerceptionPipeline perception, SpeechProvider speech,
            ExecutorService collaboratorExecutor, WatcherConfig config, ObjectMapper objectMapper) {
        return new BusCommandRouter(devices, commands, busAdapter, perception, speech,
                collaboratorExecutor, config, objectMapper);
    }

    // --- Tool bridge ---

    @Bean
    public ToolBridgeDispatcher toolBridgeDispatcher(ToolExecutor tools, ObjectMapper objectMapper) {
        return new ToolBridgeDispatcher(tools, objectMapper);
    }

    @Bean
    public ToolBridgeClient toolBridgeClient(WatcherConfig config, ToolBridgeDispatcher dispatcher,
            GatewayTimings timings) {
        URI uri = config.isToolBridgeEnabled() ? URI.create(config.getToolBridgeUrl().trim()) : null;
        return new ToolBridgeClient(new StandardWebSocketClient(), uri, dispatcher,
                timings.bridgeRetry(), timings.bridgePing());
    }

    // --- Lifecycle ---

    @Bean
    public MonitoringScheduler monitoringScheduler(GatewayLane lane, DeviceSessionManager devices,
            DeviceCommands commands, PerceptionPipeline perception, WatcherConfig config) {
        return new MonitoringScheduler(lane, devices, commands, perception, config);
    }

    @Bean
    public GatewayStartup gatewayStartup(WatcherConfig config, BusAdapter busAdapter,
            BusCommandRouter router, GatewayLane lane, ToolBridgeClient toolBridge,
            MonitoringScheduler monitoring, GatewayTimings timings) {
        return new GatewayStartup(config, busAdapter, router, lane, toolBridge, monitoring, timings,
                LoggingSystem.get(GatewayStartup.class.getClassLoader()));
    }

    @Bean
    public GatewayShutdown gatewayShutdown(MonitoringScheduler monitoring, GatewayStartup startup,
            ToolBridgeClient toolBridge, DeviceSessionManager devices, BusAdapter busAdapter,
            GatewayLane lane, ExecutorService collaboratorExecutor, VisionProvider vision,
            SpeechProvider speech, ToolExecutor tools) {
        return new GatewayShutdown(monitoring, startup, toolBridge, devices, busAdapter, lane,
                collaboratorExecutor, List.of(vision, speech, tools));
    }
}
