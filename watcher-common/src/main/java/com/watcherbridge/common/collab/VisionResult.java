package com.watcherbridge.common.collab;

/**
 * Scene description returned by a vision backend.
 *
 * @param description free text, never null
 * @param confidence  0..1 estimate that the scene warrants attention
 */
public record VisionResult(String description, double confidence) {

    public VisionResult {
        description = description != null ? description : "";
    }
}
