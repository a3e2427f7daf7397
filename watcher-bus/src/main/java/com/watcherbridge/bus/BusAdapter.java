package com.watcherbridge.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watcherbridge.common.error.TransportException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Home-automation bus facade: discovery, state, images, events and command
 * subscription.
 * <p>
 * Publishing never throws. A failed or impossible publish is logged and
 * dropped; the next state change supersedes it.
 */
@Slf4j
public class BusAdapter {

    private final BusClient client;
    private final EntityCatalog catalog;
    private final ObjectMapper objectMapper;

    public BusAdapter(BusClient client, EntityCatalog catalog, ObjectMapper objectMapper) {
        this.client = client;
        this.catalog = catalog;
        this.objectMapper = objectMapper;
    }

    /**
     * Connect with a retained {@code connected=OFF} last will.
     *
     * @return whether the broker accepted the connection
     */
    public boolean connect() {
        try {
            client.connect(new BusClient.LastWill(
                    catalog.binding("binary_sensor", "connected").stateTopic(), "OFF", true));
            return true;
        } catch (TransportException e) {
            log.error("MQTT connection error: {}", e.getMessage());
            return false;
        }
    }

    /** Publish {@code connected=OFF}, then disconnect. */
    public void disconnect() {
        publishState("binary_sensor/connected", "OFF");
        client.disconnect();
    }

    public boolean isConnected() {
        return client.isConnected();
    }

    /**
     * Announce every entity and event type, retained. Safe to repeat.
     */
    public void registerEntities() {
        Map<String, Object> device = catalog.deviceInfo();
        for (EntityDescriptor entity : catalog.entities()) {
            Map<String, Object> cfg = new LinkedHashMap<>(entity.discovery());
            cfg.put("device", device);
            publish(entity.binding().discoveryTopic(), cfg, true);
            log.debug("Registered entity: {}", entity.entityId());
        }
        for (String eventType : EntityCatalog.EVENT_TYPES) {
            publish(catalog.eventDiscoveryTopic(eventType), catalog.eventDiscovery(eventType), true);
        }
        log.info("Registered {} entities and {} events", catalog.entities().size(), EntityCatalog.EVENT_TYPES.size());
    }

    public void publishInitialStates() {
        int count = 0;
        for (EntityDescriptor entity : catalog.entities()) {
            if (entity.initialState() != null) {
                publishState(entity.entityId(), entity.initialState());
                count++;
            }
        }
        log.info("Published initial states for {} entities", count);
    }

    /**
     * Publish an entity state, retained.
     *
     * @param entityId {@code component/object}; a bare name maps to {@code <node>/<name>/state}
     * @param value    maps and lists are JSON encoded, scalars stringified
     */
    public void publishState(String entityId, Object value) {
        String topic;
        int slash = entityId.indexOf('/');
        if (slash > 0) {
            topic = catalog.binding(entityId.substring(0, slash), entityId.substring(slash + 1)).stateTopic();
        } else {
            topic = catalog.getNodeId() + "/" + entityId + "/state";
        }
        publish(topic, value, true);
        log.debug("Published state for {}: {}", entityId, value);
    }

    public void publishImage(byte[] image) {
        publishRaw(catalog.imageTopic(), image, true);
    }

    /**
     * Fire a non-retained event: {@code {event_type, ...data}}.
     */
    public void fireEvent(String eventType, Map<String, ?> data) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_type", eventType);
        if (data != null) {
            payload.putAll(data);
        }
        publish(catalog.eventStateTopic(eventType), payload, false);
        log.info("Fired event {}: {}", eventType, data);
    }

    /**
     * Route {@code <node>/+/+/set} messages to {@code callback}, always via
     * {@code executor}; nothing runs on the client's delivery thread beyond
     * topic parsing.
     */
    public void subscribeCommands(CommandCallback callback, Executor executor) {
        String filter = TopicBinding.commandFilter(catalog.getNodeId());
        client.subscribe(filter, (topic, payload) -> {
            var binding = TopicBinding.fromCommandTopic(catalog.getDiscoveryPrefix(), catalog.getNodeId(), topic);
            if (binding.isEmpty()) {
                log.debug("Ignoring message on unexpected topic {}", topic);
                return;
            }
            String text = new String(payload, StandardCharsets.UTF_8);
            String component = binding.get().component();
            String objectId = binding.get().objectId();
            executor.execute(() -> callback.onCommand(component, objectId, text));
        });
        log.info("Subscribed to command topics");
    }

    public EntityCatalog getCatalog() {
        return catalog;
    }

    private void publish(String topic, Object value, boolean retain) {
        String text;
        if (value == null) {
            text = "";
        } else if (value instanceof String s) {
            text = s;
        } else if (value instanceof Map || value instanceof Iterable || value.getClass().isArray()) {
            try {
                text = objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                log.error("Cannot encode payload for {}: {}", topic, e.getMessage());
                return;
            }
        } else {
            text = String.valueOf(value);
        }
        publishRaw(topic, text.getBytes(StandardCharsets.UTF_8), retain);
    }

    private void publishRaw(String topic, byte[] payload, boolean retain) {
        if (!client.isConnected()) {
            log.warn("Cannot publish to {}: not connected to MQTT", topic);
            return;
        }
        try {
            client.publish(topic, payload, retain);
        } catch (TransportException e) {
            log.warn("Publish to {} failed: {}", topic, e.getMessage());
        }
    }
}
