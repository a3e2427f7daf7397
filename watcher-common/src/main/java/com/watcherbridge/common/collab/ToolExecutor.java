package com.watcherbridge.common.collab;

import com.watcherbridge.common.error.CollaboratorException;
import com.watcherbridge.common.error.UnknownToolException;

import java.util.List;
import java.util.Map;

/**
 * Automation-tool backend: state queries, service calls, notifications.
 */
public interface ToolExecutor {

    List<ToolDefinition> listTools();

    /**
     * Run a named tool.
     *
     * @return text or a structured value (map, list) to be JSON encoded
     * @throws UnknownToolException  when no tool has that name
     * @throws CollaboratorException when the tool itself fails
     */
    Object execute(String name, Map<String, Object> arguments);
}
