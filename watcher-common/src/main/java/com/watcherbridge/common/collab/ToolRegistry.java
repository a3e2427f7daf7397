package com.watcherbridge.common.collab;

import com.watcherbridge.common.error.CollaboratorException;
import com.watcherbridge.common.error.UnknownToolException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ToolExecutor} backed by an explicit name → handler map.
 * Listing order follows registration order.
 */
@Slf4j
public class ToolRegistry implements ToolExecutor {

    @FunctionalInterface
    public interface ToolHandler {
        Object handle(Map<String, Object> arguments) throws Exception;
    }

    private final Map<String, ToolHandler> handlers = new ConcurrentHashMap<>();
    private final List<ToolDefinition> definitions = new CopyOnWriteArrayList<>();

    /**
     * Register a tool. Re-registering a name replaces the previous handler.
     */
    public ToolRegistry register(ToolDefinition definition, ToolHandler handler) {
        if (handlers.put(definition.name(), handler) != null) {
            definitions.removeIf(d -> d.name().equals(definition.name()));
            log.debug("Replaced tool handler: {}", definition.name());
        } else {
            log.debug("Registered tool handler: {}", definition.name());
        }
        definitions.add(definition);
        return this;
    }

    @Override
    public List<ToolDefinition> listTools() {
        return List.copyOf(new ArrayList<>(definitions));
    }

    @Override
    public Object execute(String name, Map<String, Object> arguments) {
        ToolHandler handler = name != null ? handlers.get(name) : null;
        if (handler == null) {
            throw new UnknownToolException(name);
        }
        try {
            return handler.handle(arguments != null ? arguments : Map.of());
        } catch (CollaboratorException e) {
            throw e;
        } catch (Exception e) {
            throw new CollaboratorException(name + " failed: " + e.getMessage(), e);
        }
    }

    public int size() {
        return handlers.size();
    }
}
