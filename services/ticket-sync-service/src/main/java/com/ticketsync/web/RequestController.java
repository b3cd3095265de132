package com.ticketsync.web;

import java.net.URI;
import java.security.Principal;
import java.util.UUID;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.ticketsync.domain.RequestPriority;
import com.ticketsync.domain.RequestStatus;
import com.ticketsync.repository.RequestFilter;
import com.ticketsync.service.TicketSyncService;
import com.ticketsync.service.ValidationException;
import com.ticketsync.web.dto.SubmissionResponse;
import com.ticketsync.web.dto.SyncResponse;
import com.ticketsync.web.dto.TaskRequestResponse;
import com.ticketsync.web.dto.TaskRequestSubmission;
import com.ticketsync.web.dto.TicketResponse;

import jakarta.validation.Valid;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * HTTP API for submitting task requests and following their tickets. The caller's
 * principal name becomes the owner of the requests it submits.
 */
@RestController
@RequestMapping(path = "/api/requests", produces = MediaType.APPLICATION_JSON_VALUE)
public class RequestController {

    static final int MAX_PAGE_SIZE = 100;

    private final TicketSyncService syncService;
    private final RequestMapper requestMapper;

    public RequestController(TicketSyncService syncService, RequestMapper requestMapper) {
        this.syncService = syncService;
        this.requestMapper = requestMapper;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<SubmissionResponse>> submit(
        @Valid @RequestBody TaskRequestSubmission submission,
        Principal principal
    ) {
        return syncService.submitAndCreate(principal.getName(), submission)
            .map(requestMapper::toResponse)
            .map(response -> ResponseEntity
                .created(URI.create("/api/requests/" + response.getRequestId()))
                .body(response));
    }

    @GetMapping
    public Flux<TaskRequestResponse> listRequests(
        @RequestParam(required = false) RequestStatus status,
        @RequestParam(required = false) RequestPriority priority,
        @RequestParam(defaultValue = "0") int page,
        @RequestParam(defaultValue = "20") int size,
        Principal principal
    ) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            return Flux.error(new ValidationException(
                "page must be >= 0 and size between 1 and %d".formatted(MAX_PAGE_SIZE)));
        }
        RequestFilter filter = new RequestFilter(principal.getName(), status, priority, page, size);
        return syncService.listRequests(filter)
            .map(requestMapper::toResponse);
    }

    @GetMapping("/{id}")
    public Mono<TaskRequestResponse> getRequest(@PathVariable UUID id) {
        return syncService.getRequest(id)
            .map(requestMapper::toResponse);
    }

    @PostMapping("/{id}/retry")
    public Mono<TaskRequestResponse> retry(@PathVariable UUID id) {
        return syncService.retry(id)
            .map(requestMapper::toResponse);
    }

    @PostMapping("/{id}/cancel")
    public Mono<TaskRequestResponse> cancel(@PathVariable UUID id) {
        return syncService.cancel(id)
            .map(requestMapper::toResponse);
    }

    @GetMapping("/{id}/tickets")
    public Flux<TicketResponse> listTickets(@PathVariable UUID id) {
        return syncService.listTicketsForRequest(id)
            .map(requestMapper::toResponse);
    }

    @PostMapping("/{id}/sync")
    public Mono<SyncResponse> sync(@PathVariable UUID id) {
        return syncService.syncStatuses(id)
            .map(requestMapper::toResponse);
    }

    @PreAuthorize("hasRole('ADMIN')")
    @PostMapping("/sync")
    public Mono<SyncResponse> syncStale() {
        return syncService.syncStaleTickets()
            .map(requestMapper::toResponse);
    }
}
