package com.watcherbridge.bus;

import java.util.Optional;

/**
 * Topic layout of one entity.
 *
 * @param stateTopic     {@code <node>/<component>/<object>/state}
 * @param commandTopic   {@code <node>/<component>/<object>/set}
 * @param discoveryTopic {@code <prefix>/<component>/<node>/<object>/config}
 */
public record TopicBinding(String component, String objectId,
        String stateTopic, String commandTopic, String discoveryTopic) {

    public static TopicBinding of(String discoveryPrefix, String nodeId, String component, String objectId) {
        String base = nodeId + "/" + component + "/" + objectId;
        return new TopicBinding(component, objectId,
                base + "/state",
                base + "/set",
                discoveryPrefix + "/" + component + "/" + nodeId + "/" + objectId + "/config");
    }

    /** Subscription filter matching every command topic of a node. */
    public static String commandFilter(String nodeId) {
        return nodeId + "/+/+/set";
    }

    /**
     * Resolve a concrete command topic back to its component and object id.
     */
    public static Optional<TopicBinding> fromCommandTopic(String discoveryPrefix, String nodeId, String topic) {
        if (topic == null) {
            return Optional.empty();
        }
        String[] parts = topic.split("/");
        if (parts.length != 4 || !parts[0].equals(nodeId) || !parts[3].equals("set")
                || parts[1].isEmpty() || parts[2].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(of(discoveryPrefix, nodeId, parts[1], parts[2]));
    }
}
