package com.ticketsync.integration.servicenow;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ticketsync.domain.RequestPriority;
import com.ticketsync.integration.BatchItemResult;
import com.ticketsync.integration.CreatedTicket;
import com.ticketsync.integration.RemoteRejectionException;
import com.ticketsync.integration.RemoteTicketState;
import com.ticketsync.integration.TicketPayload;
import com.ticketsync.integration.TicketingClient;
import com.ticketsync.integration.TransportException;
import com.ticketsync.integration.props.IntegrationProperties;

import reactor.core.publisher.Mono;

/**
 * ServiceNow REST API client for requested items ({@code sc_req_item}).
 *
 * <p>Single creates, reads and updates go through the Table API; batch creation uses
 * the scripted REST endpoint configured as {@code integration.servicenow.batch-path}.
 * Every call is bounded by {@code integration.servicenow.timeout} and is attempted
 * exactly once.</p>
 */
@Component
public class ServiceNowClient implements TicketingClient {

    private static final Logger log = LoggerFactory.getLogger(ServiceNowClient.class);

    private static final String STATUS_FIELDS =
        "sys_id,number,short_description,state,priority,assignment_group,assigned_to,opened_at,closed_at";

    private static final DateTimeFormatter SERVICENOW_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String NO_RESPONSE = "No response from ServiceNow";

    private final WebClient webClient;
    private final IntegrationProperties.ServiceNowProperties properties;
    private final ObjectMapper objectMapper;

    public ServiceNowClient(WebClient.Builder builder, IntegrationProperties properties, ObjectMapper objectMapper) {
        this.properties = properties.getServicenow();
        this.objectMapper = objectMapper;
        this.webClient = builder
            .baseUrl(stripTrailingSlash(this.properties.getBaseUrl()))
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.AUTHORIZATION, basicAuthHeader(this.properties.getUsername(), this.properties.getPassword()))
            .build();
    }

    @Override
    public Mono<CreatedTicket> createTicket(TicketPayload payload) {
        log.debug("Creating ServiceNow ticket '{}'", payload.title());
        return webClient.post()
            .uri(properties.getTablePath())
            .bodyValue(tableFields(payload))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(properties.getTimeout())
            .switchIfEmpty(Mono.error(() -> new TransportException(NO_RESPONSE, null)))
            .map(body -> createdTicket(body.path("result"))
                .orElseThrow(() -> new TransportException("ServiceNow response lacks sys_id or number", null)))
            .onErrorMap(error -> translate("ticket creation", error))
            .doOnSuccess(created -> log.info("Created ServiceNow ticket {} ({}) for '{}'",
                created.referenceNumber(), created.externalId(), payload.title()));
    }

    @Override
    public Mono<List<BatchItemResult>> createTickets(List<TicketPayload> payloads) {
        if (payloads.isEmpty()) {
            return Mono.just(List.of());
        }
        List<Map<String, Object>> tickets = payloads.stream().map(this::batchFields).toList();
        log.debug("Creating {} ServiceNow tickets in one batch", tickets.size());

        return webClient.post()
            .uri(properties.getBatchPath())
            .bodyValue(Map.of("tickets", tickets))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(properties.getTimeout())
            .switchIfEmpty(Mono.error(() -> new TransportException(NO_RESPONSE, null)))
            .map(body -> batchResults(body, payloads.size()))
            .onErrorMap(error -> translate("batch ticket creation", error))
            .doOnSuccess(results -> log.info("ServiceNow batch created {} of {} tickets",
                results.stream().filter(BatchItemResult::isSuccess).count(), results.size()));
    }

    @Override
    public Mono<RemoteTicketState> fetchStatus(String externalId) {
        return webClient.get()
            .uri(uri -> uri.path(properties.getTablePath() + "/{sysId}")
                .queryParam("sysparm_fields", STATUS_FIELDS)
                .build(externalId))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(properties.getTimeout())
            .switchIfEmpty(Mono.error(() -> new TransportException(NO_RESPONSE, null)))
            .map(body -> remoteState(externalId, body.path("result")))
            .onErrorMap(error -> translate("status fetch for " + externalId, error))
            .doOnSuccess(state -> log.debug("ServiceNow ticket {} is in state '{}'", externalId, state.state()));
    }

    @Override
    public Mono<Void> updateStatus(String externalId, String state, Map<String, Object> extraFields) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", state);
        if (extraFields != null) {
            extraFields.forEach((key, value) -> {
                if (value != null) {
                    body.put(key, value);
                }
            });
        }

        return webClient.patch()
            .uri(properties.getTablePath() + "/{sysId}", externalId)
            .bodyValue(body)
            .retrieve()
            .toBodilessEntity()
            .timeout(properties.getTimeout())
            .onErrorMap(error -> translate("status update for " + externalId, error))
            .doOnSuccess(response -> log.info("Updated ServiceNow ticket {} to state '{}'", externalId, state))
            .then();
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return webClient.get()
            .uri(uri -> uri.path(properties.getTablePath()).queryParam("sysparm_limit", 1).build())
            .retrieve()
            .toBodilessEntity()
            .timeout(properties.getTimeout())
            .map(response -> Boolean.TRUE)
            .onErrorResume(error -> {
                log.warn("ServiceNow connection test failed: {}", error.getMessage());
                return Mono.just(Boolean.FALSE);
            });
    }

    private Map<String, Object> tableFields(TicketPayload payload) {
        Map<String, Object> fields = new LinkedHashMap<>();
        putIfPresent(fields, "short_description", payload.title());
        putCommonFields(fields, payload);
        return fields;
    }

    private Map<String, Object> batchFields(TicketPayload payload) {
        Map<String, Object> fields = new LinkedHashMap<>();
        putIfPresent(fields, "title", payload.title());
        putCommonFields(fields, payload);
        return fields;
    }

    private void putCommonFields(Map<String, Object> fields, TicketPayload payload) {
        putIfPresent(fields, "description", payload.description());
        putIfPresent(fields, "priority", priorityCode(payload.priority()));
        putIfPresent(fields, "category", payload.category());
        putIfPresent(fields, "subcategory", payload.subcategory());
        putIfPresent(fields, "assignment_group", payload.assignmentGroup());
        payload.extraFields().forEach((key, value) -> putIfPresent(fields, key, value));
    }

    private static void putIfPresent(Map<String, Object> fields, String key, Object value) {
        if (value != null) {
            fields.put(key, value);
        }
    }

    static String priorityCode(RequestPriority priority) {
        if (priority == null) {
            return "3";
        }
        return switch (priority) {
            case CRITICAL -> "1";
            case HIGH -> "2";
            case MEDIUM -> "3";
            case LOW -> "4";
        };
    }

    private List<BatchItemResult> batchResults(JsonNode body, int expected) {
        JsonNode items = body.isArray() ? body : body.path("result");
        if (!items.isArray()) {
            throw new TransportException("Unexpected ServiceNow batch response: " + abbreviate(body.toString()), null);
        }
        List<BatchItemResult> results = new ArrayList<>(expected);
        for (int i = 0; i < expected; i++) {
            if (i >= items.size()) {
                results.add(BatchItemResult.failure(NO_RESPONSE));
                continue;
            }
            JsonNode item = items.get(i);
            Optional<CreatedTicket> created = createdTicket(item.path("result"));
            results.add(created
                .map(BatchItemResult::success)
                .orElseGet(() -> BatchItemResult.failure(itemError(item))));
        }
        return results;
    }

    private Optional<CreatedTicket> createdTicket(JsonNode result) {
        String sysId = text(result, "sys_id");
        String number = text(result, "number");
        if (sysId == null || number == null) {
            return Optional.empty();
        }
        Map<String, Object> fields = objectMapper.convertValue(result, new TypeReference<Map<String, Object>>() { });
        return Optional.of(new CreatedTicket(sysId, number, fields));
    }

    private String itemError(JsonNode item) {
        JsonNode error = item.path("error");
        String message = text(error, "message");
        if (message == null) {
            return NO_RESPONSE;
        }
        String detail = text(error, "detail");
        return detail == null ? message : message + ": " + detail;
    }

    private RemoteTicketState remoteState(String externalId, JsonNode result) {
        if (result.isMissingNode() || result.isNull()) {
            throw new TransportException("ServiceNow returned no record for " + externalId, null);
        }
        return new RemoteTicketState(
            Optional.ofNullable(text(result, "sys_id")).orElse(externalId),
            text(result, "number"),
            text(result, "state"),
            assignee(result.path("assigned_to")),
            timestamp(text(result, "opened_at")),
            timestamp(text(result, "closed_at"))
        );
    }

    // assigned_to is a reference field: a plain sys_id, or an object when display values are requested
    private static String assignee(JsonNode node) {
        if (node.isObject()) {
            String display = text(node, "display_value");
            return display != null ? display : text(node, "value");
        }
        return node.isValueNode() && !node.asText().isBlank() ? node.asText() : null;
    }

    static Instant timestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException notIso) {
            try {
                return LocalDateTime.parse(value, SERVICENOW_DATE_TIME).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException unparseable) {
                log.warn("Ignoring unparseable ServiceNow timestamp '{}'", value);
                return null;
            }
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private Throwable translate(String operation, Throwable error) {
        if (error instanceof TransportException || error instanceof RemoteRejectionException) {
            return error;
        }
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            String body = response.getResponseBodyAsString(StandardCharsets.UTF_8);
            log.warn("ServiceNow {} failed with HTTP {}: {}", operation, status, abbreviate(body));
            if (status >= 500 || status == 408 || status == 429) {
                return new TransportException("ServiceNow %s failed with HTTP %d".formatted(operation, status), error);
            }
            return new RemoteRejectionException(
                "ServiceNow rejected %s (HTTP %d): %s".formatted(operation, status, rejectionMessage(body)),
                status,
                body,
                error
            );
        }
        if (error instanceof TimeoutException) {
            log.warn("ServiceNow {} timed out after {}", operation, properties.getTimeout());
            return new TransportException("ServiceNow %s timed out after %s".formatted(operation, properties.getTimeout()), error);
        }
        log.warn("ServiceNow {} failed: {}", operation, error.getMessage());
        return new TransportException("ServiceNow %s failed: %s".formatted(operation, error.getMessage()), error);
    }

    private String rejectionMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no details";
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            String message = text(error, "message");
            if (message != null) {
                String detail = text(error, "detail");
                return detail == null ? message : message + ": " + detail;
            }
        } catch (JsonProcessingException notJson) {
            log.debug("ServiceNow error body is not JSON: {}", notJson.getOriginalMessage());
        }
        return abbreviate(body);
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }

    private static String stripTrailingSlash(String baseUrl) {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    private static String basicAuthHeader(String username, String password) {
        String token = Base64.getEncoder()
            .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        return "Basic " + token;
    }
}
