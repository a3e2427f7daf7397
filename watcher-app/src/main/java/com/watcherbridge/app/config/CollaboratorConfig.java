package com.watcherbridge.app.config;

import com.watcherbridge.common.collab.SpeechProvider;
import com.watcherbridge.common.collab.ToolExecutor;
import com.watcherbridge.common.collab.ToolRegistry;
import com.watcherbridge.common.collab.VisionProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Collaborator backends. None ship with the gateway: vision always fails,
 * speech recognizes and synthesizes nothing, and the tool registry starts
 * empty. Replace these beans to plug real backends in.
 */
@Slf4j
@Configuration
public class CollaboratorConfig {

    @Bean
    public VisionProvider visionProvider() {
        log.info("No vision backend configured; scene analysis will report nothing");
        return VisionProvider.unavailable();
    }

    @Bean
    public SpeechProvider speechProvider() {
        return SpeechProvider.NONE;
    }

    @Bean
    public ToolExecutor toolExecutor() {
        return new ToolRegistry();
    }
}
