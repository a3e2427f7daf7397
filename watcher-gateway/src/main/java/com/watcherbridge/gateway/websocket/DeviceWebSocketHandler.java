package com.watcherbridge.gateway.websocket;

import com.watcherbridge.gateway.device.DeviceSessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Device endpoint ({@code /ws}). Adapts container callbacks to
 * {@link DeviceSessionManager}; no protocol logic lives here.
 */
@Slf4j
public class DeviceWebSocketHandler extends AbstractWebSocketHandler {

    private final DeviceSessionManager sessionManager;
    private final Map<String, WebSocketDeviceChannel> channels = new ConcurrentHashMap<>();

    public DeviceWebSocketHandler(DeviceSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketDeviceChannel channel = new WebSocketDeviceChannel(session);
        channels.put(session.getId(), channel);
        log.debug("ws:in:open conn={} remote={}", session.getId(), session.getRemoteAddress());
        sessionManager.onChannelOpened(channel);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketDeviceChannel channel = channels.get(session.getId());
        if (channel != null) {
            sessionManager.onText(channel, message.getPayload());
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        WebSocketDeviceChannel channel = channels.get(session.getId());
        if (channel != null) {
            sessionManager.onBinary(channel, message.getPayloadLength());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("ws:error conn={}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketDeviceChannel channel = channels.remove(session.getId());
        log.info("ws:close conn={} code={} reason={}", session.getId(), status.getCode(), status.getReason());
        if (channel != null) {
            sessionManager.onChannelClosed(channel, status.getCode() + " " + status.getReason());
        }
    }
}
