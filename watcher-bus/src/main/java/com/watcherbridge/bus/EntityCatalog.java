package com.watcherbridge.bus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The fixed set of entities and event types a Watcher exposes on the bus.
 */
public final class EntityCatalog {

    public static final String DEVICE_NAME = "SenseCAP Watcher";
    public static final String MANUFACTURER = "Seeed Studio";
    public static final String MODEL = "SenseCAP Watcher";

    public static final List<String> DISPLAY_MODES = List.of("Clock", "Weather", "Status", "AI Log", "Custom");
    public static final List<String> EVENT_TYPES = List.of("alert", "voice_command");

    private final String discoveryPrefix;
    private final String nodeId;
    private final List<EntityDescriptor> entities;

    public EntityCatalog(String discoveryPrefix, String nodeId) {
        this.discoveryPrefix = discoveryPrefix;
        this.nodeId = nodeId;
        this.entities = List.copyOf(build());
    }

    public List<EntityDescriptor> entities() {
        return entities;
    }

    public TopicBinding binding(String component, String objectId) {
        return TopicBinding.of(discoveryPrefix, nodeId, component, objectId);
    }

    /** Shared device block attached to every discovery payload. */
    public Map<String, Object> deviceInfo() {
        Map<String, Object> device = new LinkedHashMap<>();
        device.put("identifiers", List.of(nodeId));
        device.put("name", DEVICE_NAME);
        device.put("manufacturer", MANUFACTURER);
        device.put("model", MODEL);
        return device;
    }

    public String imageTopic() {
        return nodeId + "/image/snapshot/image";
    }

    public String eventStateTopic(String eventType) {
        return nodeId + "/event/" + eventType + "/state";
    }

    public String eventDiscoveryTopic(String eventType) {
        return discoveryPrefix + "/event/" + nodeId + "_" + eventType + "/config";
    }

    /** Discovery payload of an event type, device block included. */
    public Map<String, Object> eventDiscovery(String eventType) {
        Map<String, Object> cfg = new LinkedHashMap<>();
        cfg.put("name", "Watcher " + ("alert".equals(eventType) ? "Alert" : "Voice Command"));
        cfg.put("unique_id", nodeId + "_" + eventType);
        cfg.put("state_topic", eventStateTopic(eventType));
        cfg.put("event_types", List.of(eventType));
        cfg.put("device", deviceInfo());
        return cfg;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getDiscoveryPrefix() {
        return discoveryPrefix;
    }

    private List<EntityDescriptor> build() {
        List<EntityDescriptor> out = new ArrayList<>();

        out.add(entity("image", "snapshot", "Watcher Snapshot", "snapshot", null, false, false,
                Map.of("image_topic", imageTopic())));
        out.add(onOff(entity("switch", "monitoring", "Watcher Monitoring", "monitoring", "OFF", true, true,
                Map.of())));
        out.add(entity("sensor", "last_event", "Watcher Last Event", "last_event", "", true, false,
                Map.of("icon", "mdi:message-text")));
        out.add(entity("text", "custom_prompt", "Watcher Custom Prompt", "custom_prompt", "", true, true,
                ordered("mode", "text", "max", 500)));
        out.add(entity("button", "analyze_scene", "Watcher Analyze Scene", "analyze_scene", null, false, true,
                ordered("payload_press", "PRESS", "icon", "mdi:eye")));
        out.add(onOff(entity("binary_sensor", "motion_detected", "Watcher Motion Detected", "motion_detected",
                "OFF", true, false, Map.of("device_class", "motion"))));
        out.add(entity("number", "monitoring_interval", "Watcher Monitoring Interval", "monitoring_interval",
                "30", true, true,
                ordered("min", 10, "max", 300, "step", 1, "unit_of_measurement", "s", "icon", "mdi:timer")));
        out.add(entity("number", "confidence_threshold", "Watcher Confidence Threshold", "confidence_threshold",
                "50", true, true,
                ordered("min", 0, "max", 100, "step", 1, "unit_of_measurement", "%", "icon", "mdi:percent")));
        out.add(onOff(entity("switch", "voice_assistant", "Watcher Voice Assistant", "voice_assistant", "OFF",
                true, true, Map.of("icon", "mdi:microphone"))));
        out.add(entity("notify", "tts", "Watcher TTS", "tts", null, false, true,
                Map.of("icon", "mdi:text-to-speech")));
        out.add(onOff(entity("siren", "alarm", "Watcher Siren", "siren", "OFF", true, true,
                ordered("available_tones", List.of("alarm", "alert", "chime"),
                        "support_duration", true, "support_volume_set", true))));
        out.add(onOff(entity("binary_sensor", "noise_detected", "Watcher Noise Detected", "noise_detected",
                "OFF", true, false, Map.of("device_class", "sound"))));
        out.add(entity("select", "display_mode", "Watcher Display Mode", "display_mode", "Clock", true, true,
                ordered("options", DISPLAY_MODES, "icon", "mdi:monitor")));
        out.add(entity("text", "display_message", "Watcher Display Message", "display_message", "", true, true,
                ordered("mode", "text", "max", 100, "icon", "mdi:message-text-outline")));
        out.add(onOff(entity("switch", "display_power", "Watcher Display Power", "display_power", "ON",
                true, true, Map.of("icon", "mdi:monitor-shimmer"))));
        out.add(onOff(entity("binary_sensor", "connected", "Watcher Connected", "connected", "OFF", true, false,
                Map.of("device_class", "connectivity"))));

        return out;
    }

    private EntityDescriptor entity(String component, String objectId, String name, String uniqueSuffix,
            String initialState, boolean hasState, boolean hasCommand, Map<String, Object> extra) {
        TopicBinding binding = binding(component, objectId);
        Map<String, Object> cfg = new LinkedHashMap<>();
        cfg.put("name", name);
        cfg.put("unique_id", nodeId + "_" + uniqueSuffix);
        if (hasState) {
            cfg.put("state_topic", binding.stateTopic());
        }
        if (hasCommand) {
            cfg.put("command_topic", binding.commandTopic());
        }
        cfg.putAll(extra);
        return new EntityDescriptor(binding, cfg, initialState);
    }

    private static EntityDescriptor onOff(EntityDescriptor d) {
        Map<String, Object> cfg = new LinkedHashMap<>(d.discovery());
        cfg.put("payload_on", "ON");
        cfg.put("payload_off", "OFF");
        return new EntityDescriptor(d.binding(), cfg, d.initialState());
    }

    private static Map<String, Object> ordered(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }
}
