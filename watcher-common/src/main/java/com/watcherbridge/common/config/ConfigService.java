package com.watcherbridge.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.watcherbridge.common.error.ConfigException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads {@link WatcherConfig} from the options file.
 * <p>
 * Resolution order per bus setting: options file, then the {@code MQTT_*}
 * environment variables, then built-in defaults. String values may reference
 * environment variables as {@code ${NAME}} or {@code ${NAME:-default}}.
 * Unusable values are replaced with defaults and logged; only a malformed
 * tool-bridge URL is fatal.
 */
@Slf4j
public class ConfigService {

    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Path optionsPath;
    private final Map<String, String> env;

    public ConfigService(Path optionsPath) {
        this(optionsPath, System.getenv());
    }

    public ConfigService(Path optionsPath, Map<String, String> env) {
        String pathStr = optionsPath.toString();
        if (pathStr.startsWith("~")) {
            optionsPath = Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        this.optionsPath = optionsPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Read, merge and validate the configuration.
     *
     * @throws ConfigException when a value is unusable and has no safe default
     */
    public WatcherConfig load() {
        WatcherConfig config = readOptions();
        applyEnvFallbacks(config);
        normalize(config);
        log.info("Config loaded: {}", config);
        return config;
    }

    private WatcherConfig readOptions() {
        if (!Files.exists(optionsPath)) {
            log.info("Options file {} not found, using defaults", optionsPath);
            return new WatcherConfig();
        }
        try {
            JsonNode root = objectMapper.readTree(Files.readString(optionsPath));
            if (root == null || !root.isObject()) {
                log.error("Options file {} is not a JSON object, using defaults", optionsPath);
                return new WatcherConfig();
            }
            return objectMapper.treeToValue(substituteEnvVars(root), WatcherConfig.class);
        } catch (IOException e) {
            log.error("Failed to load options from {}: {}", optionsPath, e.getMessage());
            return new WatcherConfig();
        }
    }

    private void applyEnvFallbacks(WatcherConfig config) {
        if (isBlank(config.getMqttHost())) {
            String host = env.get("MQTT_HOST");
            config.setMqttHost(!isBlank(host) ? host : WatcherConfig.DEFAULT_MQTT_HOST);
        }
        if (config.getMqttPort() == 0) {
            String port = env.get("MQTT_PORT");
            int parsed = WatcherConfig.DEFAULT_MQTT_PORT;
            if (!isBlank(port)) {
                try {
                    parsed = Integer.parseInt(port.trim());
                } catch (NumberFormatException e) {
                    log.warn("Invalid MQTT_PORT '{}', using {}", port, WatcherConfig.DEFAULT_MQTT_PORT);
                }
            }
            config.setMqttPort(parsed);
        }
        if (isBlank(config.getMqttUser()) && !isBlank(env.get("MQTT_USER"))) {
            config.setMqttUser(env.get("MQTT_USER"));
        }
        if (isBlank(config.getMqttPassword()) && !isBlank(env.get("MQTT_PASSWORD"))) {
            config.setMqttPassword(env.get("MQTT_PASSWORD"));
        }
    }

    private void normalize(WatcherConfig config) {
        if (!isValidPort(config.getWebsocketPort())) {
            log.warn("websocket_port {} out of range, using {}", config.getWebsocketPort(),
                    WatcherConfig.DEFAULT_WEBSOCKET_PORT);
            config.setWebsocketPort(WatcherConfig.DEFAULT_WEBSOCKET_PORT);
        }
        if (!isValidPort(config.getHttpPort())) {
            log.warn("http_port {} out of range, using {}", config.getHttpPort(), WatcherConfig.DEFAULT_HTTP_PORT);
            config.setHttpPort(WatcherConfig.DEFAULT_HTTP_PORT);
        }
        if (!isValidPort(config.getMqttPort())) {
            log.warn("mqtt_port {} out of range, using {}", config.getMqttPort(), WatcherConfig.DEFAULT_MQTT_PORT);
            config.setMqttPort(WatcherConfig.DEFAULT_MQTT_PORT);
        }
        if (config.getMonitoringInterval() < 10 || config.getMonitoringInterval() > 300) {
            log.warn("monitoring_interval {} outside 10..300, using {}", config.getMonitoringInterval(),
                    WatcherConfig.DEFAULT_MONITORING_INTERVAL);
            config.setMonitoringInterval(WatcherConfig.DEFAULT_MONITORING_INTERVAL);
        }
        if (config.getConfidenceThreshold() < 0 || config.getConfidenceThreshold() > 1) {
            log.warn("confidence_threshold {} outside 0..1, using {}", config.getConfidenceThreshold(),
                    WatcherConfig.DEFAULT_CONFIDENCE_THRESHOLD);
            config.setConfidenceThreshold(WatcherConfig.DEFAULT_CONFIDENCE_THRESHOLD);
        }
        if (config.getMotionThreshold() < 0 || config.getMotionThreshold() > 1) {
            log.warn("motion_threshold {} outside 0..1, using {}", config.getMotionThreshold(),
                    WatcherConfig.DEFAULT_MOTION_THRESHOLD);
            config.setMotionThreshold(WatcherConfig.DEFAULT_MOTION_THRESHOLD);
        }
        if (config.getNoiseThreshold() < 0) {
            log.warn("noise_threshold {} negative, using {}", config.getNoiseThreshold(),
                    WatcherConfig.DEFAULT_NOISE_THRESHOLD);
            config.setNoiseThreshold(WatcherConfig.DEFAULT_NOISE_THRESHOLD);
        }
        if (config.getCustomPrompt() == null) {
            config.setCustomPrompt("");
        }
        if (config.isToolBridgeEnabled()) {
            validateBridgeUrl(config.getToolBridgeUrl());
        }
    }

    private static void validateBridgeUrl(String url) {
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("ws".equalsIgnoreCase(scheme) || "wss".equalsIgnoreCase(scheme))) {
                throw new ConfigException("tool_bridge_url must be a ws:// or wss:// URL: " + url);
            }
        } catch (URISyntaxException e) {
            throw new ConfigException("tool_bridge_url is not a valid URI: " + url);
        }
    }

    /**
     * Replace {@code ${VAR}} / {@code ${VAR:-default}} references with
     * environment values. Unset variables without a default become empty.
     */
    public String substituteEnvVars(String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }
        Matcher matcher = ENV_VAR_PATTERN.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String envValue = env.get(matcher.group(1));
            String replacement = envValue != null ? envValue
                    : matcher.group(2) != null ? matcher.group(2) : "";
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private JsonNode substituteEnvVars(JsonNode node) {
        if (node.isTextual()) {
            return TextNode.valueOf(substituteEnvVars(node.asText()));
        }
        if (node.isObject()) {
            ObjectNode obj = (ObjectNode) node;
            Iterator<Map.Entry<String, JsonNode>> fields = obj.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                field.setValue(substituteEnvVars(field.getValue()));
            }
        } else if (node.isArray()) {
            ArrayNode arr = (ArrayNode) node;
            for (int i = 0; i < arr.size(); i++) {
                arr.set(i, substituteEnvVars(arr.get(i)));
            }
        }
        return node;
    }

    public Path getOptionsPath() {
        return optionsPath;
    }

    private static boolean isValidPort(int port) {
        return port > 0 && port <= 65535;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
