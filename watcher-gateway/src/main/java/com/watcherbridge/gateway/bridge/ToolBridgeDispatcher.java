package com.watcherbridge.gateway.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.watcherbridge.common.collab.ToolDefinition;
import com.watcherbridge.common.collab.ToolExecutor;
import com.watcherbridge.common.config.WatcherVersion;
import com.watcherbridge.common.model.JsonRpcMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes JSON-RPC messages from the remote tool broker to registered
 * handlers and renders the reply frame, if any.
 * <p>
 * Requests (with an id) get exactly one reply. Notifications and the
 * broker's own replies produce none.
 */
@Slf4j
public class ToolBridgeDispatcher {

    static final String PROTOCOL_VERSION = "2024-11-05";

    @FunctionalInterface
    public interface MethodHandler {
        Object handle(JsonNode params) throws Exception;
    }

    @FunctionalInterface
    public interface NotificationHandler {
        void handle(JsonNode params);
    }

    private static final TypeReference<Map<String, Object>> ARGS = new TypeReference<>() {
    };

    private final Map<String, MethodHandler> methodHandlers = new ConcurrentHashMap<>();
    private final Map<String, NotificationHandler> notificationHandlers = new ConcurrentHashMap<>();
    private final ToolExecutor tools;
    private final ObjectMapper objectMapper;
    private volatile boolean initialized;

    public ToolBridgeDispatcher(ToolExecutor tools, ObjectMapper objectMapper) {
        this.tools = tools;
        this.objectMapper = objectMapper;

        registerMethod("initialize", params -> initialize());
        registerNotification("notifications/initialized", params -> {
            initialized = true;
            log.info("Tool broker handshake complete");
        });
        registerMethod("tools/list", params -> listTools());
        registerMethod("tools/call", this::callTool);
        registerMethod("ping", params -> Map.of());
    }

    public void registerMethod(String method, MethodHandler handler) {
        methodHandlers.put(method, handler);
        log.debug("Registered method handler: {}", method);
    }

    public void registerNotification(String method, NotificationHandler handler) {
        notificationHandlers.put(method, handler);
        log.debug("Registered notification handler: {}", method);
    }

    /**
     * Handle one text frame from the broker.
     *
     * @return the reply frame to send back, if the message calls for one
     */
    public Optional<String> dispatch(String text) {
        JsonNode message;
        try {
            message = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Dropping malformed tool broker frame: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (message == null || !message.isObject()) {
            log.warn("Dropping non-object tool broker frame");
            return Optional.empty();
        }

        JsonNode id = message.get("id");
        boolean hasId = id != null && !id.isNull();
        String method = message.path("method").asText(null);
        JsonNode params = message.path("params");

        if (method == null) {
            if (message.has("result") || message.has("error")) {
                log.debug("Consumed broker reply for id {}", id);
            } else {
                log.debug("Ignoring broker frame without method");
            }
            return Optional.empty();
        }

        if (!hasId) {
            NotificationHandler handler = notificationHandlers.get(method);
            if (handler != null) {
                try {
                    handler.handle(params);
                } catch (Exception e) {
                    log.error("Notification handler failed for {}: {}", method, e.getMessage(), e);
                }
            } else {
                log.debug("No handler for notification: {}", method);
            }
            return Optional.empty();
        }

        MethodHandler handler = methodHandlers.get(method);
        JsonRpcMessage.Response response;
        if (handler == null) {
            response = JsonRpcMessage.Response.error(id, JsonRpcMessage.METHOD_NOT_FOUND,
                    "Method not found: " + method);
        } else {
            try {
                response = JsonRpcMessage.Response.success(id, handler.handle(params));
            } catch (Exception e) {
                log.error("Method handler failed for {}: {}", method, e.getMessage(), e);
                response = JsonRpcMessage.Response.error(id, JsonRpcMessage.INTERNAL_ERROR, e.getMessage());
            }
        }
        return Optional.of(encode(response));
    }

    public boolean isInitialized() {
        return initialized;
    }

    public Set<String> getRegisteredMethods() {
        return Collections.unmodifiableSet(methodHandlers.keySet());
    }

    // --- Methods ---

    private Map<String, Object> initialize() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", PROTOCOL_VERSION);
        result.put("capabilities", Map.of("tools", Map.of("listChanged", false)));
        result.put("serverInfo", Map.of("name", WatcherVersion.NAME, "version", WatcherVersion.VERSION));
        return result;
    }

    private Map<String, Object> listTools() {
        List<Map<String, Object>> list = tools.listTools().stream()
                .map(ToolBridgeDispatcher::describe)
                .toList();
        return Map.of("tools", list);
    }

    private JsonRpcMessage.ToolCallResult callTool(JsonNode params) {
        String name = params.path("name").asText(null);
        Map<String, Object> arguments = params.path("arguments").isObject()
                ? objectMapper.convertValue(params.get("arguments"), ARGS)
                : Map.of();
        log.info("Tool call: {}({})", name, arguments);
        try {
            Object result = tools.execute(name, arguments);
            return JsonRpcMessage.ToolCallResult.text(render(result));
        } catch (RuntimeException e) {
            log.warn("Tool {} failed: {}", name, e.getMessage());
            return JsonRpcMessage.ToolCallResult.failure(e.getMessage());
        }
    }

    private String render(Object result) {
        if (result == null) {
            return "";
        }
        if (result instanceof String s) {
            return s;
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            return String.valueOf(result);
        }
    }

    private static Map<String, Object> describe(ToolDefinition tool) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", tool.name());
        entry.put("description", tool.description());
        entry.put("inputSchema", tool.inputSchema() != null ? tool.inputSchema() : Map.of("type", "object"));
        return entry;
    }

    private String encode(JsonRpcMessage.Response response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("Failed to encode reply for id {}: {}", response.getId(), e.getMessage());
            ObjectNode fallback = objectMapper.createObjectNode();
            fallback.put("jsonrpc", JsonRpcMessage.VERSION);
            fallback.set("id", objectMapper.valueToTree(response.getId()));
            fallback.set("error", objectMapper.createObjectNode()
                    .put("code", JsonRpcMessage.INTERNAL_ERROR)
                    .put("message", "encoding failed"));
            return fallback.toString();
        }
    }
}
