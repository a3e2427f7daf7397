package com.watcherbridge.gateway.device;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decoded device-to-gateway text frame.
 */
public interface DeviceMessage {

    String type();

    record Hello(JsonNode raw) implements DeviceMessage {
        @Override
        public String type() {
            return "hello";
        }
    }

    record Listen(String state) implements DeviceMessage {
        @Override
        public String type() {
            return "listen";
        }

        /** {@code detect} and {@code start} open a listen turn the gateway closes. */
        public boolean opensTurn() {
            return "detect".equals(state) || "start".equals(state);
        }
    }

    /** 16-bit PCM carried as hex in {@code payload.data}. */
    record Audio(byte[] data) implements DeviceMessage {
        @Override
        public String type() {
            return "audio";
        }
    }

    /** Encoded camera frame carried as hex in {@code payload.data}. */
    record Image(byte[] data) implements DeviceMessage {
        @Override
        public String type() {
            return "image";
        }
    }

    /** Embedded JSON-RPC traffic from the device, usually tool-call replies. */
    record Mcp(JsonNode payload) implements DeviceMessage {
        @Override
        public String type() {
            return "mcp";
        }
    }

    /** {@code wheel}, {@code button} and {@code status}: logged only. */
    record Informational(String type, JsonNode payload) implements DeviceMessage {
    }

    record Unrecognized(String type, JsonNode raw) implements DeviceMessage {
    }
}
