package com.ticketsync.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.ticketsync.integration.props.IntegrationProperties;

/**
 * Infrastructure shared by the synchronization engine.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    /**
     * Every timestamp the engine writes is read from this clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ApplicationRunner syncSettingsReport(IntegrationProperties properties) {
        IntegrationProperties.SyncProperties sync = properties.getSync();
        return args -> log.info(
            "ServiceNow at {} (timeout {}); max retries {}, stale after {}, concurrency {}, remote cancel {}",
            properties.getServicenow().getBaseUrl(),
            properties.getServicenow().getTimeout(),
            sync.getMaxRetries(),
            sync.getStaleAfter(),
            sync.getMaxConcurrency(),
            sync.isCancelRemoteTickets() ? "on" : "off");
    }
}
