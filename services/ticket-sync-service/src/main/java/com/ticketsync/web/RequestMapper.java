package com.ticketsync.web;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.ticketsync.domain.Attributes;
import com.ticketsync.domain.TaskRequest;
import com.ticketsync.domain.Ticket;
import com.ticketsync.integration.props.IntegrationProperties;
import com.ticketsync.service.SubmissionResult;
import com.ticketsync.service.SyncSummary;
import com.ticketsync.web.dto.SubmissionResponse;
import com.ticketsync.web.dto.SyncResponse;
import com.ticketsync.web.dto.TaskRequestResponse;
import com.ticketsync.web.dto.TicketResponse;

/**
 * Centralises conversion between persistence objects and API DTOs so the shape of
 * responses stays consistent across endpoints.
 */
@Component
public class RequestMapper {

    private static final String TICKET_PATH = "/nav_to.do?uri=sc_req_item.do?sys_id=";

    private final String serviceNowBaseUrl;

    public RequestMapper(IntegrationProperties properties) {
        String baseUrl = properties.getServicenow().getBaseUrl();
        this.serviceNowBaseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public SubmissionResponse toResponse(SubmissionResult result) {
        TaskRequest request = result.request();
        List<TicketResponse> tickets = result.tickets().stream().map(this::toResponse).toList();
        return new SubmissionResponse(request.getId(), request.getStatus(), request.getFailureReason(), tickets);
    }

    public TaskRequestResponse toResponse(TaskRequest request) {
        return new TaskRequestResponse(
            request.getId(),
            request.getOwnerId(),
            request.getTitle(),
            request.getDescription(),
            request.getBusinessTaskType(),
            request.getStatus(),
            request.getPriority(),
            asMap(request.getPayload()),
            request.getRetryCount(),
            request.getMaxRetries(),
            request.canRetry(),
            request.getFailureReason(),
            request.getProcessingStarted(),
            request.getProcessingCompleted(),
            request.processingTime().map(Duration::toMillis).orElse(null),
            request.getEstimatedCompletion(),
            request.getActualCompletion(),
            request.getCreatedAt(),
            request.getUpdatedAt()
        );
    }

    public TicketResponse toResponse(Ticket ticket) {
        return new TicketResponse(
            ticket.getId(),
            ticket.getRequestId(),
            ticket.getExternalId(),
            ticket.getReferenceNumber(),
            ticketUrl(ticket),
            ticket.getTitle(),
            ticket.getDescription(),
            ticket.getStatus(),
            ticket.getPriority(),
            ticket.getCategory(),
            ticket.getSubcategory(),
            ticket.getAssignmentGroup(),
            ticket.getAssignedTo(),
            asMap(ticket.getExtraFields()),
            ticket.getSyncStatus(),
            ticket.getSyncError(),
            ticket.getLastSyncAt(),
            ticket.getClosedInExternalAt(),
            ticket.getCreatedAt(),
            ticket.getUpdatedAt()
        );
    }

    public SyncResponse toResponse(SyncSummary summary) {
        return new SyncResponse(summary.synced(), summary.failed(), summary.skipped());
    }

    /**
     * Link into the ServiceNow UI, or {@code null} while the ticket only exists locally.
     */
    String ticketUrl(Ticket ticket) {
        if (!ticket.isCreatedExternally()) {
            return null;
        }
        return serviceNowBaseUrl + TICKET_PATH + ticket.getExternalId();
    }

    private static Map<String, Object> asMap(Attributes attributes) {
        return attributes == null ? Map.of() : attributes.asMap();
    }
}
