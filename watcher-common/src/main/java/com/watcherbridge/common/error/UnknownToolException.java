package com.watcherbridge.common.error;

import lombok.Getter;

/**
 * A tool call named a tool that is not in the registry.
 */
@Getter
public class UnknownToolException extends CollaboratorException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
        this.toolName = toolName;
    }
}
