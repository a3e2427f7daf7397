package com.watcherbridge.app.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.watcherbridge.bus.BusAdapter;
import com.watcherbridge.gateway.bridge.ToolBridgeClient;
import com.watcherbridge.gateway.device.DeviceSessionManager;
import com.watcherbridge.gateway.device.ReconnectController;
import com.watcherbridge.gateway.handshake.HandshakeController;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;

/**
 * Liveness and gateway state for container health checks.
 */
@RestController
public class HealthEndpoint {

    private final ObjectMapper mapper;
    private final DeviceSessionManager devices;
    private final ReconnectController reconnect;
    private final BusAdapter bus;
    private final ToolBridgeClient toolBridge;
    private final HandshakeController handshake;

    public HealthEndpoint(ObjectMapper mapper, DeviceSessionManager devices, ReconnectController reconnect,
            BusAdapter bus, ToolBridgeClient toolBridge, HandshakeController handshake) {
        this.mapper = mapper;
        this.devices = devices;
        this.reconnect = reconnect;
        this.bus = bus;
        this.toolBridge = toolBridge;
        this.handshake = handshake;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        var node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());

        var device = node.putObject("device");
        devices.getCurrentSession().ifPresentOrElse(session -> {
            device.put("state", session.getState().name());
            device.put("session_id", session.getSessionId());
            device.put("connected_at", session.getConnectedAt().toString());
        }, () -> device.put("state", "DISCONNECTED"));
        device.put("outbox_depth", devices.getOutboxDepth());
        device.put("reconnect_delay_ms", reconnect.getCurrentDelayMs());
        device.put("consecutive_failures", reconnect.getConsecutiveFailures());

        node.putObject("bus").put("connected", bus.isConnected());

        var bridge = node.putObject("tool_bridge");
        bridge.put("enabled", toolBridge.isEnabled());
        bridge.put("connected", toolBridge.isConnected());

        handshake.getLastCheckin().ifPresent(checkin -> {
            var last = node.putObject("last_checkin");
            last.put("mac", checkin.mac());
            last.put("version", checkin.version());
            last.put("ip", checkin.ip());
            last.put("at", checkin.at().toString());
        });
        return node;
    }
}
