package com.watcherbridge.common.config;

import com.watcherbridge.common.error.ConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path optionsPath;

    @BeforeEach
    void setUp() {
        optionsPath = tempDir.resolve("options.json");
    }

    @Test
    void load_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "websocket_port": 9000,
                  "http_port": 9001,
                  "custom_prompt": "Look for cats",
                  "confidence_threshold": 0.8,
                  "mqtt_host": "broker.local",
                  "unknown_key": true
                }
                """;
        Files.writeString(optionsPath, json);

        WatcherConfig config = new ConfigService(optionsPath, Map.of()).load();

        assertEquals(9000, config.getWebsocketPort());
        assertEquals(9001, config.getHttpPort());
        assertEquals("Look for cats", config.getCustomPrompt());
        assertEquals(0.8, config.getConfidenceThreshold(), 1e-9);
        assertEquals("broker.local", config.getMqttHost());
        assertEquals(1883, config.getMqttPort());
    }

    @Test
    void load_missingFile_returnsDefaults() {
        WatcherConfig config = new ConfigService(tempDir.resolve("nonexistent.json"), Map.of()).load();

        assertEquals(8000, config.getWebsocketPort());
        assertEquals("core-mosquitto", config.getMqttHost());
        assertEquals(1883, config.getMqttPort());
        assertEquals("sensecap_watcher", config.getNodeId());
        assertFalse(config.isToolBridgeEnabled());
    }

    @Test
    void load_invalidJson_fallsBackToDefaults() throws IOException {
        Files.writeString(optionsPath, "{ not json");

        WatcherConfig config = new ConfigService(optionsPath, Map.of()).load();

        assertEquals(8001, config.getHttpPort());
    }

    @Test
    void load_mqttFromEnvironment_whenNotInOptions() {
        Map<String, String> env = Map.of(
                "MQTT_HOST", "10.0.0.2",
                "MQTT_PORT", "1884",
                "MQTT_USER", "ha",
                "MQTT_PASSWORD", "secret");

        WatcherConfig config = new ConfigService(optionsPath, env).load();

        assertEquals("10.0.0.2", config.getMqttHost());
        assertEquals(1884, config.getMqttPort());
        assertEquals("ha", config.getMqttUser());
        assertEquals("secret", config.getMqttPassword());
        assertFalse(config.toString().contains("secret"));
    }

    @Test
    void load_invalidMqttPortEnv_usesDefault() {
        WatcherConfig config = new ConfigService(optionsPath, Map.of("MQTT_PORT", "abc")).load();
        assertEquals(1883, config.getMqttPort());
    }

    @Test
    void load_outOfRangeValues_replacedWithDefaults() throws IOException {
        Files.writeString(optionsPath, """
                { "websocket_port": 70000, "monitoring_interval": 5, "confidence_threshold": 3.0 }
                """);

        WatcherConfig config = new ConfigService(optionsPath, Map.of()).load();

        assertEquals(8000, config.getWebsocketPort());
        assertEquals(30, config.getMonitoringInterval());
        assertEquals(0.5, config.getConfidenceThreshold(), 1e-9);
    }

    @Test
    void load_malformedBridgeUrl_isFatal() throws IOException {
        Files.writeString(optionsPath, """
                { "tool_bridge_url": "http://broker.example/mcp" }
                """);

        ConfigService service = new ConfigService(optionsPath, Map.of());
        assertThrows(ConfigException.class, service::load);
    }

    @Test
    void load_envReferenceInOptions_isSubstituted() throws IOException {
        Files.writeString(optionsPath, """
                { "tool_bridge_url": "wss://${BROKER_HOST}/mcp?token=${BROKER_TOKEN:-none}" }
                """);

        WatcherConfig config = new ConfigService(optionsPath, Map.of("BROKER_HOST", "agent.example")).load();

        assertEquals("wss://agent.example/mcp?token=none", config.getToolBridgeUrl());
        assertTrue(config.isToolBridgeEnabled());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = new ConfigService(optionsPath, Map.of());
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_missingWithoutDefault_isEmpty() {
        ConfigService service = new ConfigService(optionsPath, Map.of());
        assertEquals("a--b", service.substituteEnvVars("a-${__UNLIKELY_VAR_XYZ}-b"));
    }
}
