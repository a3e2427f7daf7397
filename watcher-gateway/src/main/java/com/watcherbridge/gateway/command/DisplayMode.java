package com.watcherbridge.gateway.command;

import java.util.Arrays;
import java.util.Optional;

/**
 * Display modes offered on the bus and the face the device shows for each.
 */
public enum DisplayMode {
    CLOCK("Clock", "neutral"),
    WEATHER("Weather", "cool"),
    STATUS("Status", "thinking"),
    AI_LOG("AI Log", "confident"),
    CUSTOM("Custom", "neutral");

    private final String label;
    private final String emotion;

    DisplayMode(String label, String emotion) {
        this.label = label;
        this.emotion = emotion;
    }

    public String getLabel() {
        return label;
    }

    public String getEmotion() {
        return emotion;
    }

    /** Exact, case-sensitive label match. */
    public static Optional<DisplayMode> fromLabel(String label) {
        return Arrays.stream(values()).filter(m -> m.label.equals(label)).findFirst();
    }
}
