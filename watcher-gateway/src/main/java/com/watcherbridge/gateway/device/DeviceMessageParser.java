package com.watcherbridge.gateway.device;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.watcherbridge.common.error.ProtocolException;

import java.util.HexFormat;
import java.util.Map;
import java.util.function.Function;

/**
 * Text frame → {@link DeviceMessage}, dispatched on {@code type} through a fixed table.
 */
public class DeviceMessageParser {

    private static final HexFormat HEX = HexFormat.of();

    private final ObjectMapper objectMapper;
    private final Map<String, Function<JsonNode, DeviceMessage>> decoders = Map.of(
            "hello", DeviceMessage.Hello::new,
            "listen", node -> new DeviceMessage.Listen(node.path("state").asText("")),
            "audio", node -> new DeviceMessage.Audio(hexData(node)),
            "image", node -> new DeviceMessage.Image(hexData(node)),
            "mcp", node -> new DeviceMessage.Mcp(payload(node)),
            "wheel", node -> new DeviceMessage.Informational("wheel", payload(node)),
            "button", node -> new DeviceMessage.Informational("button", payload(node)),
            "status", node -> new DeviceMessage.Informational("status", payload(node)));

    public DeviceMessageParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws ProtocolException on malformed JSON, a non-object frame or bad hex
     */
    public DeviceMessage parse(String text) {
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid JSON from device: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Device frame is not a JSON object");
        }
        String type = node.path("type").asText("");
        Function<JsonNode, DeviceMessage> decoder = decoders.get(type);
        return decoder != null ? decoder.apply(node) : new DeviceMessage.Unrecognized(type, node);
    }

    private static JsonNode payload(JsonNode node) {
        JsonNode payload = node.get("payload");
        return payload != null ? payload : NullNode.getInstance();
    }

    private static byte[] hexData(JsonNode node) {
        String hex = node.path("payload").path("data").asText("");
        try {
            return HEX.parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Invalid hex payload in " + node.path("type").asText() + " frame", e);
        }
    }
}
