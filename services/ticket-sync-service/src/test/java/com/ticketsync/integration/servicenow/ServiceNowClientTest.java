package com.ticketsync.integration.servicenow;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ticketsync.domain.RequestPriority;
import com.ticketsync.integration.BatchItemResult;
import com.ticketsync.integration.RemoteRejectionException;
import com.ticketsync.integration.TicketPayload;
import com.ticketsync.integration.TransportException;
import com.ticketsync.integration.props.IntegrationProperties;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import reactor.test.StepVerifier;

/**
 * Wire contract of {@link ServiceNowClient}, exercised against {@link MockWebServer}.
 */
@DisplayName("ServiceNow client")
class ServiceNowClientTest {

    private static final String TABLE_PATH = "/api/now/table/sc_req_item";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private ServiceNowClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = newClient(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private ServiceNowClient newClient(Duration timeout) {
        IntegrationProperties properties = new IntegrationProperties();
        properties.getServicenow().setBaseUrl(server.url("/").toString());
        properties.getServicenow().setUsername("svc-sync");
        properties.getServicenow().setPassword("s3cret");
        properties.getServicenow().setTimeout(timeout);
        return new ServiceNowClient(WebClient.builder(), properties, objectMapper);
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
            .setResponseCode(status)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }

    private static TicketPayload laptop() {
        return new TicketPayload("Laptop", "MacBook for new hire", RequestPriority.HIGH, "hardware", null,
            "IT Desk", Map.of("u_cost_center", "CC-42"));
    }

    private JsonNode body(RecordedRequest request) throws IOException {
        return objectMapper.readTree(request.getBody().readUtf8());
    }

    @Nested
    @DisplayName("createTicket")
    class CreateTicket {

        @Test
        @DisplayName("posts the ticket to the table API with basic auth")
        void postsToTableApi() throws Exception {
            // Given
            server.enqueue(json(201, "{\"result\":{\"sys_id\":\"a1b2c3\",\"number\":\"RITM0010001\",\"state\":\"1\"}}"));

            // When & Then
            StepVerifier.create(client.createTicket(laptop()))
                .assertNext(created -> {
                    assertThat(created.externalId()).isEqualTo("a1b2c3");
                    assertThat(created.referenceNumber()).isEqualTo("RITM0010001");
                    assertThat(created.fields()).containsEntry("state", "1");
                })
                .verifyComplete();

            RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
            assertThat(recorded.getMethod()).isEqualTo("POST");
            assertThat(recorded.getPath()).isEqualTo(TABLE_PATH);
            assertThat(recorded.getHeader("Authorization")).isEqualTo("Basic "
                + Base64.getEncoder().encodeToString("svc-sync:s3cret".getBytes(StandardCharsets.UTF_8)));
            JsonNode sent = body(recorded);
            assertThat(sent.path("short_description").asText()).isEqualTo("Laptop");
            assertThat(sent.path("priority").asText()).isEqualTo("2");
            assertThat(sent.path("assignment_group").asText()).isEqualTo("IT Desk");
            assertThat(sent.path("u_cost_center").asText()).isEqualTo("CC-42");
            assertThat(sent.has("subcategory")).isFalse();
        }

        @Test
        @DisplayName("treats a response without a number as a transport failure")
        void requiresBothIdentifiers() {
            server.enqueue(json(201, "{\"result\":{\"sys_id\":\"a1b2c3\"}}"));

            StepVerifier.create(client.createTicket(laptop()))
                .expectError(TransportException.class)
                .verify();
        }

        @Test
        @DisplayName("maps a 400 to a rejection carrying status and body")
        void rejectsOnClientError() {
            // Given
            String error = "{\"error\":{\"message\":\"Invalid field\",\"detail\":\"u_cost_center is read-only\"},\"status\":\"failure\"}";
            server.enqueue(json(400, error));

            // When & Then
            StepVerifier.create(client.createTicket(laptop()))
                .expectErrorSatisfies(thrown -> {
                    assertThat(thrown).isInstanceOf(RemoteRejectionException.class)
                        .hasMessageContaining("Invalid field: u_cost_center is read-only");
                    RemoteRejectionException rejection = (RemoteRejectionException) thrown;
                    assertThat(rejection.getStatusCode()).isEqualTo(400);
                    assertThat(rejection.getResponseBody()).isEqualTo(error);
                })
                .verify();
        }

        @Test
        @DisplayName("maps server errors and throttling to transport failures")
        void transportOnServerErrors() {
            server.enqueue(json(503, "{}"));
            server.enqueue(json(429, "{}"));

            StepVerifier.create(client.createTicket(laptop()))
                .expectError(TransportException.class)
                .verify();
            StepVerifier.create(client.createTicket(laptop()))
                .expectError(TransportException.class)
                .verify();
            assertThat(server.getRequestCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("gives up after the configured timeout without retrying")
        void timesOut() {
            // Given
            ServiceNowClient impatient = newClient(Duration.ofMillis(200));
            server.enqueue(json(201, "{\"result\":{\"sys_id\":\"a1b2c3\",\"number\":\"RITM0010001\"}}")
                .setHeadersDelay(2, TimeUnit.SECONDS));

            // When & Then
            StepVerifier.create(impatient.createTicket(laptop()))
                .expectErrorSatisfies(thrown -> assertThat(thrown)
                    .isInstanceOf(TransportException.class)
                    .hasMessageContaining("timed out"))
                .verify(Duration.ofSeconds(5));
            assertThat(server.getRequestCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("createTickets")
    class CreateTickets {

        @Test
        @DisplayName("returns one result per payload in request order")
        void mixedBatch() throws Exception {
            // Given
            server.enqueue(json(200, """
                {"result":[
                  {"result":{"sys_id":"a1","number":"RITM0000001"}},
                  {"error":{"message":"Invalid category","detail":"hardwarez"}}
                ]}
                """));
            TicketPayload badge = new TicketPayload("Badge", null, RequestPriority.LOW, null, null, null, null);
            TicketPayload accounts = new TicketPayload("Accounts", null, null, null, null, null, null);

            // When
            List<BatchItemResult> results = client.createTickets(List.of(laptop(), badge, accounts)).block();

            // Then
            assertThat(results).hasSize(3);
            assertThat(results.get(0).isSuccess()).isTrue();
            assertThat(results.get(0).ticket().externalId()).isEqualTo("a1");
            assertThat(results.get(1).error()).isEqualTo("Invalid category: hardwarez");
            assertThat(results.get(2).error()).isEqualTo("No response from ServiceNow");

            RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
            assertThat(recorded.getPath()).isEqualTo("/api/x_ticket_automation/multiple_ticket_creation");
            JsonNode tickets = body(recorded).path("tickets");
            assertThat(tickets.size()).isEqualTo(3);
            assertThat(tickets.get(0).path("title").asText()).isEqualTo("Laptop");
            assertThat(tickets.get(1).path("priority").asText()).isEqualTo("4");
            assertThat(tickets.get(2).path("priority").asText()).isEqualTo("3");
        }

        @Test
        @DisplayName("accepts a bare array response")
        void bareArray() {
            server.enqueue(json(200, "[{\"result\":{\"sys_id\":\"a1\",\"number\":\"RITM0000001\"}}]"));

            List<BatchItemResult> results = client.createTickets(List.of(laptop())).block();

            assertThat(results).singleElement().satisfies(result -> assertThat(result.isSuccess()).isTrue());
        }

        @Test
        @DisplayName("does not call ServiceNow for an empty batch")
        void emptyBatch() {
            assertThat(client.createTickets(List.of()).block()).isEmpty();
            assertThat(server.getRequestCount()).isZero();
        }
    }

    @Nested
    @DisplayName("fetchStatus")
    class FetchStatus {

        @Test
        @DisplayName("reads state, assignee and timestamps")
        void readsRemoteState() throws Exception {
            // Given
            server.enqueue(json(200, """
                {"result":{"sys_id":"a1b2c3","number":"RITM0010001","state":"4",
                  "assigned_to":{"display_value":"Jane Doe","value":"6816f79c"},
                  "opened_at":"2025-03-01 08:00:00","closed_at":""}}
                """));

            // When & Then
            StepVerifier.create(client.fetchStatus("a1b2c3"))
                .assertNext(state -> {
                    assertThat(state.externalId()).isEqualTo("a1b2c3");
                    assertThat(state.referenceNumber()).isEqualTo("RITM0010001");
                    assertThat(state.state()).isEqualTo("4");
                    assertThat(state.assignee()).isEqualTo("Jane Doe");
                    assertThat(state.openedAt()).isEqualTo(Instant.parse("2025-03-01T08:00:00Z"));
                    assertThat(state.closedAt()).isNull();
                })
                .verifyComplete();

            RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
            assertThat(recorded.getMethod()).isEqualTo("GET");
            assertThat(recorded.getRequestUrl().encodedPath()).isEqualTo(TABLE_PATH + "/a1b2c3");
            assertThat(recorded.getRequestUrl().queryParameter("sysparm_fields")).contains("state", "assigned_to");
        }

        @Test
        @DisplayName("maps a missing record to a rejection")
        void unknownTicket() {
            server.enqueue(json(404, "{\"error\":{\"message\":\"No Record found\"},\"status\":\"failure\"}"));

            StepVerifier.create(client.fetchStatus("missing"))
                .expectErrorSatisfies(thrown -> assertThat(thrown)
                    .isInstanceOf(RemoteRejectionException.class)
                    .hasMessageContaining("No Record found"))
                .verify();
        }
    }

    @Nested
    @DisplayName("updateStatus and healthCheck")
    class UpdateAndHealth {

        @Test
        @DisplayName("patches the state together with extra fields")
        void patchesState() throws Exception {
            server.enqueue(json(200, "{\"result\":{}}"));

            StepVerifier.create(client.updateStatus("a1b2c3", "6", Map.of("work_notes", "Cancelled by requester")))
                .verifyComplete();

            RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
            assertThat(recorded.getMethod()).isEqualTo("PATCH");
            assertThat(recorded.getPath()).isEqualTo(TABLE_PATH + "/a1b2c3");
            JsonNode sent = body(recorded);
            assertThat(sent.path("state").asText()).isEqualTo("6");
            assertThat(sent.path("work_notes").asText()).isEqualTo("Cancelled by requester");
        }

        @Test
        @DisplayName("reports a healthy instance")
        void healthy() throws Exception {
            server.enqueue(json(200, "{\"result\":[]}"));

            StepVerifier.create(client.healthCheck()).expectNext(true).verifyComplete();

            RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
            assertThat(recorded.getRequestUrl().queryParameter("sysparm_limit")).isEqualTo("1");
        }

        @Test
        @DisplayName("reports an unhealthy instance instead of failing")
        void unhealthy() {
            server.enqueue(json(500, "{}"));

            StepVerifier.create(client.healthCheck()).expectNext(false).verifyComplete();
        }
    }

    @Test
    @DisplayName("parses ISO and ServiceNow timestamps and ignores anything else")
    void parsesTimestamps() {
        assertThat(ServiceNowClient.timestamp("2025-03-01T08:00:00Z")).isEqualTo(Instant.parse("2025-03-01T08:00:00Z"));
        assertThat(ServiceNowClient.timestamp("2025-03-01 08:00:00")).isEqualTo(Instant.parse("2025-03-01T08:00:00Z"));
        assertThat(ServiceNowClient.timestamp("yesterday")).isNull();
        assertThat(ServiceNowClient.timestamp(null)).isNull();
    }

    @Test
    @DisplayName("sends priorities as ServiceNow codes")
    void priorityCodes() {
        assertThat(ServiceNowClient.priorityCode(RequestPriority.CRITICAL)).isEqualTo("1");
        assertThat(ServiceNowClient.priorityCode(RequestPriority.HIGH)).isEqualTo("2");
        assertThat(ServiceNowClient.priorityCode(RequestPriority.MEDIUM)).isEqualTo("3");
        assertThat(ServiceNowClient.priorityCode(RequestPriority.LOW)).isEqualTo("4");
        assertThat(ServiceNowClient.priorityCode(null)).isEqualTo("3");
    }
}
