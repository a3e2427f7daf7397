package com.watcherbridge.bus;

import java.util.Map;

/**
 * One entity announced through discovery.
 *
 * @param discovery    discovery payload without the device block
 * @param initialState state published at startup, or {@code null} for entities without state
 */
public record EntityDescriptor(TopicBinding binding, Map<String, Object> discovery, String initialState) {

    public String component() {
        return binding.component();
    }

    public String objectId() {
        return binding.objectId();
    }

    /** {@code component/object}, the key used by state publication and the command router. */
    public String entityId() {
        return binding.component() + "/" + binding.objectId();
    }
}
