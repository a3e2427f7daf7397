package com.watcherbridge.gateway.websocket;

import com.watcherbridge.common.error.TransportException;
import com.watcherbridge.gateway.device.DeviceChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * {@link DeviceChannel} over a Spring {@link WebSocketSession}.
 */
@Slf4j
class WebSocketDeviceChannel implements DeviceChannel {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 8 * 1024 * 1024;

    private final WebSocketSession session;

    WebSocketDeviceChannel(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void sendText(String text) {
        if (!session.isOpen()) {
            throw new TransportException("connection " + session.getId() + " is closed");
        }
        try {
            session.sendMessage(new TextMessage(text));
        } catch (IOException | RuntimeException e) {
            throw new TransportException("send to " + session.getId() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        try {
            if (session.isOpen()) {
                session.close(CloseStatus.GOING_AWAY);
            }
        } catch (IOException e) {
            log.debug("close error: {}", e.getMessage());
        }
    }

    @Override
    public String localHost() {
        InetSocketAddress local = session.getLocalAddress();
        if (local == null || local.getAddress() == null) {
            return null;
        }
        return local.getAddress().getHostAddress();
    }
}
