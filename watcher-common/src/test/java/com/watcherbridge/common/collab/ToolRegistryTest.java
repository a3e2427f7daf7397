package com.watcherbridge.common.collab;

import com.watcherbridge.common.error.CollaboratorException;
import com.watcherbridge.common.error.UnknownToolException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry()
                .register(new ToolDefinition("get_weather", "Weather state", Map.of("type", "object")),
                        args -> Map.of("entity_id", args.get("entity_id"), "state", "sunny"))
                .register(new ToolDefinition("broken", "Always fails", Map.of("type", "object")),
                        args -> {
                            throw new IllegalStateException("backend down");
                        });
    }

    @Test
    void execute_registeredTool_returnsResult() {
        Object result = registry.execute("get_weather", Map.of("entity_id", "weather.home"));
        assertEquals(Map.of("entity_id", "weather.home", "state", "sunny"), result);
    }

    @Test
    void execute_unknownTool_throwsTyped() {
        UnknownToolException e = assertThrows(UnknownToolException.class,
                () -> registry.execute("nope", Map.of()));
        assertEquals("nope", e.getToolName());
    }

    @Test
    void execute_handlerFailure_wrappedAsCollaboratorError() {
        CollaboratorException e = assertThrows(CollaboratorException.class,
                () -> registry.execute("broken", null));
        assertTrue(e.getMessage().contains("backend down"));
    }

    @Test
    void listTools_keepsRegistrationOrder_andReplaces() {
        registry.register(new ToolDefinition("get_weather", "Weather v2", Map.of()), args -> "ok");

        List<ToolDefinition> tools = registry.listTools();
        assertEquals(2, tools.size());
        assertEquals("broken", tools.get(0).name());
        assertEquals("Weather v2", tools.get(1).description());
        assertEquals("ok", registry.execute("get_weather", Map.of()));
    }
}
