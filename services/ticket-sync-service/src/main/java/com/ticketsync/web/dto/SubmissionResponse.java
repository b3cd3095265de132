package com.ticketsync.web.dto;

import java.util.List;
import java.util.UUID;

import com.ticketsync.domain.RequestStatus;

/**
 * Returned after a submission: the outcome of the request with the tickets created for it.
 */
public class SubmissionResponse {

    private final UUID requestId;
    private final RequestStatus status;
    private final String failureReason;
    private final List<TicketResponse> tickets;

    public SubmissionResponse(UUID requestId, RequestStatus status, String failureReason, List<TicketResponse> tickets) {
        this.requestId = requestId;
        this.status = status;
        this.failureReason = failureReason;
        this.tickets = tickets;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public RequestStatus getStatus() {
        return status;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public List<TicketResponse> getTickets() {
        return tickets;
    }
}
