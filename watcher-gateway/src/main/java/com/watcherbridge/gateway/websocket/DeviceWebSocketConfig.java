package com.watcherbridge.gateway.websocket;

import com.watcherbridge.gateway.device.DeviceSessionManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the device WebSocket endpoint at /ws.
 * Image and audio frames arrive as hex inside text messages, so buffers are large.
 */
@Configuration
@EnableWebSocket
public class DeviceWebSocketConfig implements WebSocketConfigurer {

    private static final int MAX_MESSAGE_BYTES = 4 * 1024 * 1024;

    private final DeviceSessionManager sessionManager;

    public DeviceWebSocketConfig(DeviceSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(deviceWebSocketHandler(), "/ws")
                .setAllowedOrigins("*");
    }

    @Bean
    public DeviceWebSocketHandler deviceWebSocketHandler() {
        return new DeviceWebSocketHandler(sessionManager);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(MAX_MESSAGE_BYTES);
        container.setMaxBinaryMessageBufferSize(MAX_MESSAGE_BYTES);
        return container;
    }
}
