package com.ticketsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.ticketsync.integration.props.IntegrationProperties;

/**
 * Spring Boot entry point for the ticket sync service.
 *
 * <p>The application accepts task requests, opens the matching ServiceNow tickets and
 * keeps their local status in step with the remote system.</p>
 */
@SpringBootApplication
@EnableConfigurationProperties(IntegrationProperties.class)
public class TicketSyncApp {

    public static void main(String[] args) {
        SpringApplication.run(TicketSyncApp.class, args);
    }
}
