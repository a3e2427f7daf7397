package com.watcherbridge.common.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway identity reported to the device, the bus and the tool broker.
 */
public final class WatcherVersion {

    private WatcherVersion() {
    }

    public static final String NAME = "watcher-bridge";
    public static final String VERSION = "1.0.0";
    public static final String BUILD = "1";
    public static final String DATE = "2024-01-01";

    /**
     * Static version document served to the device.
     */
    public static Map<String, Object> document() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("version", VERSION);
        doc.put("build", BUILD);
        doc.put("date", DATE);
        return doc;
    }
}
