package com.ticketsync.domain;

import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when an operation would move a request along an edge the lifecycle does
 * not allow, e.g. cancelling a completed request or retrying past the retry limit.
 * The request is left untouched.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidTransitionException extends RuntimeException {

    private final UUID requestId;
    private final RequestStatus from;
    private final RequestStatus to;

    public InvalidTransitionException(UUID requestId, RequestStatus from, RequestStatus to, String detail) {
        super("Request %s cannot move from %s to %s: %s".formatted(requestId, from, to, detail));
        this.requestId = requestId;
        this.from = from;
        this.to = to;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public RequestStatus getFrom() {
        return from;
    }

    public RequestStatus getTo() {
        return to;
    }
}
