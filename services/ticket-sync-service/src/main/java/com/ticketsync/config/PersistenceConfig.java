package com.ticketsync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.r2dbc.convert.R2dbcCustomConversions;
import org.springframework.data.r2dbc.dialect.DialectResolver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ticketsync.repository.AttributesConverters;
import com.ticketsync.repository.TaskRequestRepository;

import io.r2dbc.spi.ConnectionFactory;

/**
 * R2DBC wiring: JSON conversions for attribute maps and a startup probe.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    public R2dbcCustomConversions r2dbcCustomConversions(ConnectionFactory connectionFactory, ObjectMapper objectMapper) {
        return R2dbcCustomConversions.of(
            DialectResolver.getDialect(connectionFactory),
            AttributesConverters.all(objectMapper)
        );
    }

    /**
     * Counts stored requests once at startup so a broken connection shows up in the
     * log before the first submission.
     */
    @Bean
    public ApplicationRunner databaseProbe(TaskRequestRepository repository) {
        return args -> repository.count()
            .subscribe(
                count -> log.info("Ticket sync service started. Existing request count: {}", count),
                error -> log.error("Database probe failed: {}", error.getMessage())
            );
    }
}
