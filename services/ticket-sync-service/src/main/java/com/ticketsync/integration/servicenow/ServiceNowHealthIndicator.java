package com.ticketsync.integration.servicenow;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;

import com.ticketsync.integration.TicketingClient;
import com.ticketsync.integration.props.IntegrationProperties;

import reactor.core.publisher.Mono;

/**
 * Reports ServiceNow reachability under {@code /actuator/health}. Purely
 * informational; the engine never consults it.
 */
@Component
public class ServiceNowHealthIndicator implements ReactiveHealthIndicator {

    private final TicketingClient ticketingClient;
    private final String baseUrl;

    public ServiceNowHealthIndicator(TicketingClient ticketingClient, IntegrationProperties properties) {
        this.ticketingClient = ticketingClient;
        this.baseUrl = properties.getServicenow().getBaseUrl();
    }

    @Override
    public Mono<Health> health() {
        return ticketingClient.healthCheck()
            .map(reachable -> (reachable ? Health.up() : Health.down())
                .withDetail("baseUrl", baseUrl)
                .build());
    }
}
