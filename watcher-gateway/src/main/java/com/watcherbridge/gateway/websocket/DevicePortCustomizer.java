package com.watcherbridge.gateway.websocket;

import com.watcherbridge.common.config.WatcherConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.catalina.connector.Connector;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;

/**
 * Binds the HTTP listener to {@code http_port} and, when it differs, opens a
 * second connector on {@code websocket_port} for the device socket.
 */
@Slf4j
public class DevicePortCustomizer implements WebServerFactoryCustomizer<TomcatServletWebServerFactory> {

    private final WatcherConfig config;

    public DevicePortCustomizer(WatcherConfig config) {
        this.config = config;
    }

    @Override
    public void customize(TomcatServletWebServerFactory factory) {
        factory.setPort(config.getHttpPort());
        if (config.getWebsocketPort() != config.getHttpPort()) {
            Connector connector = new Connector(TomcatServletWebServerFactory.DEFAULT_PROTOCOL);
            connector.setPort(config.getWebsocketPort());
            factory.addAdditionalTomcatConnectors(connector);
            log.info("Device WebSocket listener on port {}", config.getWebsocketPort());
        }
        log.info("HTTP listener on port {}", config.getHttpPort());
    }
}
