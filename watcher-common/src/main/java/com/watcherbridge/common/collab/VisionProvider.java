package com.watcherbridge.common.collab;

import com.watcherbridge.common.error.CollaboratorException;

/**
 * Image-understanding backend (cloud API or local model).
 * Implementations may block; callers keep them off the gateway lane.
 */
@FunctionalInterface
public interface VisionProvider {

    /**
     * Describe an image.
     *
     * @throws CollaboratorException when the backend fails
     */
    VisionResult analyze(byte[] image, String prompt);

    /**
     * Placeholder used when no backend is configured: every call fails.
     */
    static VisionProvider unavailable() {
        return (image, prompt) -> {
            throw new CollaboratorException("no vision backend configured");
        };
    }
}
