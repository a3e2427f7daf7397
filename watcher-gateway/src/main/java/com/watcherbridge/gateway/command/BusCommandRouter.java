package com.watcherbridge.gateway.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watcherbridge.bus.BusAdapter;
import com.watcherbridge.bus.CommandCallback;
import com.watcherbridge.common.collab.SpeechProvider;
import com.watcherbridge.common.config.WatcherConfig;
import com.watcherbridge.gateway.device.DeviceCommands;
import com.watcherbridge.gateway.device.DeviceSessionManager;
import com.watcherbridge.perception.PerceptionPipeline;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Maps bus commands ({@code component/object} + payload) to device commands
 * and runtime config changes. Runs on the gateway lane; state-bearing
 * entities echo the applied value back to their state topic.
 */
@Slf4j
public class BusCommandRouter implements CommandCallback {

    @FunctionalInterface
    interface Action {
        void apply(String payload) throws Exception;
    }

    private static final TypeReference<Map<String, Object>> ARGS = new TypeReference<>() {
    };

    private final DeviceSessionManager devices;
    private final DeviceCommands commands;
    private final BusAdapter bus;
    private final PerceptionPipeline perception;
    private final SpeechProvider speech;
    private final Executor collaboratorExecutor;
    private final WatcherConfig config;
    private final ObjectMapper objectMapper;
    private final Map<String, Action> actions = new HashMap<>();

    public BusCommandRouter(DeviceSessionManager devices, DeviceCommands commands, BusAdapter bus,
            PerceptionPipeline perception, SpeechProvider speech, Executor collaboratorExecutor,
            WatcherConfig config, ObjectMapper objectMapper) {
        this.devices = devices;
        this.commands = commands;
        this.bus = bus;
        this.perception = perception;
        this.speech = speech;
        this.collaboratorExecutor = collaboratorExecutor;
        this.config = config;
        this.objectMapper = objectMapper;

        register("switch", "monitoring", this::monitoring);
        register("button", "analyze_scene", p -> analyzeScene());
        register("text", "custom_prompt", this::customPrompt);
        register("number", "monitoring_interval", this::monitoringInterval);
        register("number", "confidence_threshold", this::confidenceThreshold);
        register("switch", "voice_assistant", this::voiceAssistant);
        register("notify", "tts", this::speak);
        register("siren", "alarm", this::siren);
        register("select", "display_mode", this::displayMode);
        register("text", "display_message", this::displayMessage);
        register("switch", "display_power", this::displayPower);
        register("raw", "mcp", this::rawToolCall);
    }

    @Override
    public void onCommand(String component, String objectId, String payload) {
        String key = component + "/" + objectId;
        Action action = actions.get(key);
        if (action == null) {
            log.debug("No route for bus command {}", key);
            return;
        }
        log.debug("Bus command: {} = {}", key, payload);
        try {
            action.apply(payload);
        } catch (Exception e) {
            log.error("Error handling bus command {}: {}", key, e.getMessage());
        }
    }

    public Set<String> routes() {
        return Collections.unmodifiableSet(actions.keySet());
    }

    private void register(String component, String objectId, Action action) {
        actions.put(component + "/" + objectId, action);
    }

    // --- Actions ---

    private void monitoring(String payload) {
        boolean enabled = isOn(payload);
        perception.setMonitoringEnabled(enabled);
        log.info("Monitoring {}", enabled ? "enabled" : "disabled");
        bus.publishState("switch/monitoring", enabled ? "ON" : "OFF");
    }

    private void analyzeScene() {
        devices.sendToDevice(commands.alert("Analyzing", "Analyzing scene...", "thinking"));
        devices.sendToDevice(commands.requestFrame());
        perception.requestForcedAnalysis();
    }

    private void customPrompt(String payload) {
        config.setCustomPrompt(payload);
        bus.publishState("text/custom_prompt", payload);
    }

    private void monitoringInterval(String payload) {
        int seconds = (int) Math.round(Double.parseDouble(payload.trim()));
        int clamped = Math.max(10, Math.min(300, seconds));
        if (clamped != seconds) {
            log.warn("monitoring_interval {} outside 10..300, using {}", seconds, clamped);
        }
        config.setMonitoringInterval(clamped);
        bus.publishState("number/monitoring_interval", String.valueOf(clamped));
    }

    private void confidenceThreshold(String payload) {
        double percent = Double.parseDouble(payload.trim());
        config.setConfidenceThreshold(Math.max(0.0, Math.min(1.0, percent / 100.0)));
        bus.publishState("number/confidence_threshold", payload);
    }

    private void voiceAssistant(String payload) {
        config.setVoiceAssistant(isOn(payload));
        bus.publishState("switch/voice_assistant", payload);
    }

    private void speak(String payload) {
        devices.sendToDevice(commands.ttsSentence(payload));
        CompletableFuture.supplyAsync(() -> speech.synthesize(payload), collaboratorExecutor)
                .whenComplete((audio, err) -> {
                    if (err != null) {
                        log.warn("Speech synthesis failed: {}", err.getMessage());
                    } else if (audio != null && audio.length > 0) {
                        devices.sendToDevice(commands.audioPlay(audio));
                    }
                });
    }

    private void siren(String payload) {
        if (isOn(payload)) {
            devices.sendToDevice(commands.alert("ALARM", "Alarm triggered!", "shocked"));
        } else {
            devices.sendToDevice(commands.emotion("neutral"));
        }
        bus.publishState("siren/alarm", payload);
    }

    private void displayMode(String payload) {
        DisplayMode.fromLabel(payload).ifPresentOrElse(mode -> {
            devices.sendToDevice(commands.emotion(mode.getEmotion()));
            bus.publishState("select/display_mode", payload);
        }, () -> log.warn("Ignoring unknown display mode '{}'", payload));
    }

    private void displayMessage(String payload) {
        devices.sendToDevice(commands.ttsSentence(payload));
        bus.publishState("text/display_message", payload);
    }

    private void displayPower(String payload) {
        boolean on = isOn(payload);
        if (on) {
            devices.sendToDevice(commands.emotion("neutral"));
        }
        bus.publishState("switch/display_power", on ? "ON" : "OFF");
    }

    /**
     * Payload is either {@code {"name": ..., "arguments": {...}}} or a bare tool name.
     */
    private void rawToolCall(String payload) {
        String name = payload.trim();
        Map<String, Object> arguments = Map.of();
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node != null && node.isObject()) {
                name = node.path("name").asText(name);
                JsonNode args = node.get("arguments");
                if (args != null && args.isObject()) {
                    arguments = objectMapper.convertValue(args, ARGS);
                }
            }
        } catch (JsonProcessingException e) {
            // bare tool name
        }
        devices.sendToDevice(commands.toolCall(devices.nextMcpId(), name, arguments));
        log.info("Sent MCP tool call: {}({})", name, arguments);
    }

    private static boolean isOn(String payload) {
        return payload != null && "ON".equalsIgnoreCase(payload.trim());
    }
}
