package com.ticketsync.integration.props;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.BindHandler;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.bind.handler.NoUnboundElementsBindHandler;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;

@DisplayName("Integration properties binding")
class IntegrationPropertiesTest {

    private static IntegrationProperties bind(StandardEnvironment environment) {
        IntegrationProperties properties = new IntegrationProperties();
        Binder.get(environment).bind("integration", Bindable.ofInstance(properties),
            new NoUnboundElementsBindHandler(BindHandler.DEFAULT));
        return properties;
    }

    @Test
    @DisplayName("every key of the packaged application.yml is consumed")
    void bindsPackagedDefaults() throws IOException {
        // Given
        StandardEnvironment environment = new StandardEnvironment();
        new YamlPropertySourceLoader().load("application", new ClassPathResource("application.yml"))
            .forEach(source -> environment.getPropertySources().addLast(source));

        // When
        IntegrationProperties properties = bind(environment);

        // Then
        assertThat(properties.getServicenow().getTablePath()).isEqualTo("/api/now/table/sc_req_item");
        assertThat(properties.getServicenow().getBatchPath())
            .isEqualTo("/api/x_ticket_automation/multiple_ticket_creation");
        assertThat(properties.getSync().getMaxRetries()).isEqualTo(3);
        assertThat(properties.getSync().getStaleAfter()).isEqualTo(Duration.ofMinutes(5));
        assertThat(properties.getSync().getMaxConcurrency()).isEqualTo(4);
    }

    @Test
    @DisplayName("rejects ServiceNow settings the client does not use")
    void rejectsUnusedServiceNowKeys() {
        // Given
        StandardEnvironment environment = new StandardEnvironment();
        environment.getPropertySources().addFirst(new MapPropertySource("test", Map.of(
            "integration.servicenow.username", "ticket-sync",
            "integration.servicenow.client-id", "ticket-sync-app")));

        // When & Then
        assertThatThrownBy(() -> bind(environment))
            .isInstanceOf(BindException.class)
            .rootCause()
            .hasMessageContaining("integration.servicenow.client-id");
    }
}
