package com.watcherbridge.common.collab;

import java.util.Map;

/**
 * Declared schema of one automation tool.
 *
 * @param name        unique tool name
 * @param description human-readable purpose
 * @param inputSchema JSON schema of the arguments object
 */
public record ToolDefinition(String name, String description, Map<String, Object> inputSchema) {
}
