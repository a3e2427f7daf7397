package com.watcherbridge.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Watcher bridge application entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.watcherbridge")
public class WatcherBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(WatcherBridgeApplication.class, args);
    }
}
