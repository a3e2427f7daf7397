package com.watcherbridge.app.config;

import com.watcherbridge.gateway.runtime.GatewayShutdown;
import com.watcherbridge.gateway.runtime.GatewayStartup;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Ties the gateway boot and shutdown sequences to the Spring lifecycle:
 * start once the web server is listening, stop before the beans go away.
 */
@Slf4j
@Component
public class GatewayBootstrap {

    private final GatewayStartup startup;
    private final GatewayShutdown shutdown;

    public GatewayBootstrap(GatewayStartup startup, GatewayShutdown shutdown) {
        this.startup = startup;
        this.shutdown = shutdown;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        startup.start();
    }

    @PreDestroy
    public void onDestroy() {
        shutdown.shutdown();
    }
}
