package com.ticketsync.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.ticketsync.domain.Attributes;
import com.ticketsync.domain.RequestLifecycle;
import com.ticketsync.domain.RequestStatus;
import com.ticketsync.domain.TaskRequest;
import com.ticketsync.domain.Ticket;
import com.ticketsync.domain.TicketStatus;
import com.ticketsync.integration.BatchItemResult;
import com.ticketsync.integration.RemoteRejectionException;
import com.ticketsync.integration.RemoteTicketState;
import com.ticketsync.integration.TicketPayload;
import com.ticketsync.integration.TicketingClient;
import com.ticketsync.integration.props.IntegrationProperties;
import com.ticketsync.repository.RequestFilter;
import com.ticketsync.repository.TaskRequestStore;
import com.ticketsync.web.dto.TaskRequestSubmission;
import com.ticketsync.web.dto.TicketSpec;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Synchronization engine between task requests and their external tickets.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Persist a request with its ticket stubs and open the tickets remotely in one batch</li>
 *   <li>Roll per-ticket outcomes up into the request status</li>
 *   <li>Retry failed requests for the tickets that were not created yet</li>
 *   <li>Pull remote ticket states and reconcile stuck requests</li>
 * </ul>
 * The engine never retries on its own: a failed remote call is recorded and only an
 * explicit {@link #retry(UUID)} tries again. Per-ticket failures are recorded on the
 * ticket; whole-operation failures are persisted on the request and re-thrown.</p>
 */
@Service
public class TicketSyncService {

    private static final Logger log = LoggerFactory.getLogger(TicketSyncService.class);

    static final String UNMAPPED_STATE_FIELD = "unmappedRemoteState";

    private final TaskRequestStore store;
    private final TicketingClient ticketingClient;
    private final StatusMapper statusMapper;
    private final IntegrationProperties.SyncProperties syncProperties;
    private final Clock clock;

    public TicketSyncService(
        TaskRequestStore store,
        TicketingClient ticketingClient,
        StatusMapper statusMapper,
        IntegrationProperties properties,
        Clock clock
    ) {
        this.store = store;
        this.ticketingClient = ticketingClient;
        this.statusMapper = statusMapper;
        this.syncProperties = properties.getSync();
        this.clock = clock;
    }

    /**
     * Stores a new request with one stub per desired ticket, then creates all tickets
     * remotely. The returned request is COMPLETED when every ticket was created and
     * FAILED otherwise; tickets that were created stay linked either way.
     */
    public Mono<SubmissionResult> submitAndCreate(String ownerId, TaskRequestSubmission submission) {
        return Mono.defer(() -> {
            validate(ownerId, submission);
            Instant now = clock.instant();
            TaskRequest request = TaskRequest.newRequest(
                ownerId,
                submission.getTitle(),
                submission.getDescription(),
                submission.getBusinessTaskType(),
                submission.getPriority(),
                Attributes.of(submission.getPayload()),
                syncProperties.getMaxRetries(),
                now
            );
            request.setEstimatedCompletion(submission.getEstimatedCompletion());
            List<Ticket> stubs = submission.getTickets().stream()
                .map(spec -> stub(request, spec, now))
                .toList();

            return store.createWithTickets(request, stubs)
                .doOnSuccess(persisted -> log.info("Request {} submitted by {} with {} tickets",
                    persisted.request().getId(), ownerId, persisted.tickets().size()))
                .flatMap(persisted -> createTickets(persisted.request(), persisted.tickets()));
        });
    }

    /**
     * Re-attempts a failed request. Only tickets without an external id are sent
     * again, so a partially successful request never gets duplicate tickets.
     */
    public Mono<TaskRequest> retry(UUID requestId) {
        return loadRequest(requestId)
            .flatMap(request -> {
                RequestLifecycle.prepareRetry(request, clock.instant());
                log.info("Retrying request {} (attempt {} of {})",
                    request.getId(), request.getRetryCount(), request.getMaxRetries());
                return store.saveRequest(request);
            })
            .flatMap(pending -> store.findTickets(pending.getId())
                .collectList()
                .flatMap(tickets -> createTickets(pending, tickets)))
            .map(SubmissionResult::request);
    }

    /**
     * Cancels a request that is not completed yet. Remote tickets are only touched
     * when {@code integration.sync.cancel-remote-tickets} is enabled, and then on a
     * best-effort basis.
     */
    public Mono<TaskRequest> cancel(UUID requestId) {
        return loadRequest(requestId)
            .flatMap(request -> {
                RequestStatus previous = request.getStatus();
                RequestLifecycle.cancel(request, clock.instant());
                log.info("Cancelling request {} (was {})", request.getId(), previous);
                return store.saveRequest(request);
            })
            .flatMap(cancelled -> syncProperties.isCancelRemoteTickets()
                ? cancelRemoteTickets(cancelled).thenReturn(cancelled)
                : Mono.just(cancelled));
    }

    public Mono<TaskRequest> getRequest(UUID requestId) {
        return loadRequest(requestId);
    }

    public Flux<TaskRequest> listRequests(RequestFilter filter) {
        return store.findRequests(filter);
    }

    public Flux<Ticket> listTicketsForRequest(UUID requestId) {
        return loadRequest(requestId)
            .flatMapMany(request -> store.findTickets(request.getId()));
    }

    /**
     * Pulls the remote state of every linked ticket of a request. A failing ticket is
     * marked and the pass continues; the request itself is never failed by a sync.
     * A request left in PROCESSING for too long is re-derived from its tickets.
     */
    public Mono<SyncSummary> syncStatuses(UUID requestId) {
        return loadRequest(requestId)
            .flatMap(request -> store.findTickets(requestId)
                .concatMap(this::syncTicket)
                .collectList()
                .flatMap(results -> {
                    List<Ticket> tickets = results.stream().map(TicketSync::ticket).toList();
                    SyncSummary summary = results.stream()
                        .map(TicketSync::summary)
                        .reduce(SyncSummary.EMPTY, SyncSummary::plus);
                    log.info("Synced request {}: {} synced, {} failed, {} skipped",
                        requestId, summary.synced(), summary.failed(), summary.skipped());
                    return reconcile(request, tickets).thenReturn(summary);
                }));
    }

    /**
     * Syncs every open linked ticket whose last sync is older than
     * {@code integration.sync.stale-after}, across all requests.
     */
    public Mono<SyncSummary> syncStaleTickets() {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            return store.findOpenLinkedTickets()
                .filter(ticket -> ticket.needsSync(now, syncProperties.getStaleAfter()))
                .flatMap(this::syncTicket, syncProperties.getMaxConcurrency())
                .map(TicketSync::summary)
                .reduce(SyncSummary.EMPTY, SyncSummary::plus)
                .doOnSuccess(summary -> log.info("Stale ticket sync: {} synced, {} failed",
                    summary.synced(), summary.failed()));
        });
    }

    private void validate(String ownerId, TaskRequestSubmission submission) {
        if (!StringUtils.hasText(ownerId)) {
            throw new ValidationException("An owner is required");
        }
        if (submission == null || !StringUtils.hasText(submission.getTitle())) {
            throw new ValidationException("Title is required");
        }
        List<TicketSpec> tickets = submission.getTickets();
        if (tickets == null || tickets.isEmpty()) {
            throw new ValidationException("At least one ticket is required");
        }
        if (tickets.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("Ticket entries must not be null");
        }
    }

    private Ticket stub(TaskRequest request, TicketSpec spec, Instant now) {
        return Ticket.stub(
            request.getId(),
            StringUtils.hasText(spec.getTitle()) ? spec.getTitle() : request.getTitle(),
            StringUtils.hasText(spec.getDescription()) ? spec.getDescription() : request.getDescription(),
            spec.getPriority() != null ? spec.getPriority() : request.getPriority(),
            spec.getCategory(),
            spec.getSubcategory(),
            spec.getAssignmentGroup(),
            Attributes.of(spec.getFields()),
            now
        );
    }

    private Mono<SubmissionResult> createTickets(TaskRequest request, List<Ticket> tickets) {
        RequestLifecycle.startProcessing(request, clock.instant());
        return store.saveRequest(request)
            .flatMap(processing -> createPendingTickets(request.getId(), tickets)
                .flatMap(updated -> rollUp(processing, updated))
                .onErrorResume(error -> recordFailure(processing, error)));
    }

    private Mono<List<Ticket>> createPendingTickets(UUID requestId, List<Ticket> tickets) {
        List<Ticket> pending = tickets.stream().filter(ticket -> !ticket.isCreatedExternally()).toList();
        if (pending.isEmpty()) {
            return Mono.just(tickets);
        }
        List<TicketPayload> payloads = pending.stream().map(this::payload).toList();

        return Mono.defer(() -> ticketingClient.createTickets(payloads))
            .onErrorResume(RemoteRejectionException.class, rejection -> {
                log.warn("Batch of {} tickets for request {} was rejected: {}",
                    pending.size(), requestId, rejection.getMessage());
                return Mono.just(Collections.nCopies(pending.size(), BatchItemResult.failure(rejection.getMessage())));
            })
            .flatMapMany(results -> {
                Instant now = clock.instant();
                return Flux.range(0, pending.size())
                    .concatMap(i -> store.saveTicket(applyCreation(requestId, pending.get(i), resultAt(results, i), now)));
            })
            .collectList()
            .map(saved -> {
                Map<UUID, Ticket> byId = saved.stream().collect(Collectors.toMap(Ticket::getId, Function.identity()));
                return tickets.stream().map(ticket -> byId.getOrDefault(ticket.getId(), ticket)).toList();
            });
    }

    private static BatchItemResult resultAt(List<BatchItemResult> results, int index) {
        if (index < results.size() && results.get(index) != null) {
            return results.get(index);
        }
        return BatchItemResult.failure("No result returned for this ticket");
    }

    private Ticket applyCreation(UUID requestId, Ticket ticket, BatchItemResult result, Instant now) {
        if (result.isSuccess()) {
            ticket.markCreated(result.ticket().externalId(), result.ticket().referenceNumber(), now);
        } else {
            log.warn("Ticket '{}' of request {} was not created: {}", ticket.getTitle(), requestId, result.error());
            ticket.recordSyncFailure(result.error(), now);
        }
        return ticket;
    }

    private Mono<SubmissionResult> rollUp(TaskRequest request, List<Ticket> tickets) {
        Instant now = clock.instant();
        List<Ticket> missing = tickets.stream().filter(ticket -> !ticket.isCreatedExternally()).toList();
        if (missing.isEmpty()) {
            RequestLifecycle.complete(request, now);
            log.info("Request {} completed with {} tickets", request.getId(), tickets.size());
        } else {
            RequestLifecycle.fail(request, failureSummary(missing, tickets.size()), now);
            log.warn("Request {} failed: {}", request.getId(), request.getFailureReason());
        }
        return store.saveRequest(request)
            .map(saved -> new SubmissionResult(saved, tickets));
    }

    private static String failureSummary(List<Ticket> missing, int total) {
        String details = missing.stream()
            .map(ticket -> "%s: %s".formatted(ticket.getTitle(),
                ticket.getSyncError() == null ? "not created" : ticket.getSyncError()))
            .collect(Collectors.joining("; "));
        String prefix = missing.size() == total
            ? "All %d tickets failed".formatted(total)
            : "%d of %d tickets failed".formatted(missing.size(), total);
        return prefix + ": " + details;
    }

    private Mono<SubmissionResult> recordFailure(TaskRequest request, Throwable error) {
        log.error("Processing of request {} failed: {}", request.getId(), messageOf(error));
        if (request.getStatus() != RequestStatus.PROCESSING) {
            return Mono.error(error);
        }
        RequestLifecycle.fail(request, messageOf(error), clock.instant());
        return store.saveRequest(request)
            .onErrorResume(saveError -> {
                log.error("Could not record failure of request {}: {}", request.getId(), saveError.getMessage());
                error.addSuppressed(saveError);
                return Mono.empty();
            })
            .then(Mono.error(error));
    }

    private Mono<TicketSync> syncTicket(Ticket ticket) {
        if (!ticket.isCreatedExternally()) {
            log.debug("Skipping sync of ticket {}: not created remotely yet", ticket.getId());
            return Mono.just(new TicketSync(ticket, new SyncSummary(0, 0, 1)));
        }
        return Mono.defer(() -> ticketingClient.fetchStatus(ticket.getExternalId()))
            .map(remote -> {
                applyRemoteState(ticket, remote, clock.instant());
                return new SyncSummary(1, 0, 0);
            })
            .onErrorResume(error -> {
                log.warn("Failed to sync ticket {} ({}): {}", ticket.getId(), ticket.getExternalId(), messageOf(error));
                ticket.recordSyncFailure(messageOf(error), clock.instant());
                return Mono.just(new SyncSummary(0, 1, 0));
            })
            .flatMap(summary -> store.saveTicket(ticket)
                .map(saved -> new TicketSync(saved, summary))
                .onErrorResume(error -> {
                    log.warn("Could not store sync result of ticket {} ({}): {}",
                        ticket.getId(), ticket.getExternalId(), messageOf(error));
                    return Mono.just(new TicketSync(ticket, new SyncSummary(0, 1, 0)));
                }));
    }

    private void applyRemoteState(Ticket ticket, RemoteTicketState remote, Instant now) {
        StatusMapping mapping = statusMapper.map(remote.state());
        if (!mapping.recognized()) {
            ticket.putExtraField(UNMAPPED_STATE_FIELD, remote.state());
        }
        if (remote.assignee() != null) {
            ticket.setAssignedTo(remote.assignee());
        }
        TicketStatus status = mapping.status();
        if (status != ticket.getStatus()) {
            log.info("Ticket {} ({}) moved from {} to {}",
                ticket.getId(), ticket.getReferenceNumber(), ticket.getStatus(), status);
            ticket.setStatus(status);
            ticket.setUpdatedInExternalAt(now);
            if (status == TicketStatus.RESOLVED || status == TicketStatus.CLOSED) {
                ticket.setClosedInExternalAt(remote.closedAt() != null ? remote.closedAt() : now);
            }
        }
        ticket.recordSyncSuccess(now);
    }

    private Mono<Void> reconcile(TaskRequest request, List<Ticket> tickets) {
        if (request.getStatus() != RequestStatus.PROCESSING || request.getProcessingStarted() == null) {
            return Mono.empty();
        }
        Instant staleBefore = clock.instant().minus(syncProperties.getProcessingStaleAfter());
        if (!request.getProcessingStarted().isBefore(staleBefore)) {
            return Mono.empty();
        }
        log.warn("Request {} has been processing since {}; re-deriving its status",
            request.getId(), request.getProcessingStarted());
        return rollUp(request, tickets).then();
    }

    private Mono<Void> cancelRemoteTickets(TaskRequest request) {
        String cancelledState = statusMapper.toRemoteCode(TicketStatus.CANCELLED);
        return store.findTickets(request.getId())
            .filter(ticket -> ticket.isCreatedExternally() && ticket.isOpen())
            .concatMap(ticket -> Mono.defer(() -> ticketingClient.updateStatus(ticket.getExternalId(), cancelledState, Map.of()))
                .then(Mono.fromSupplier(() -> markCancelled(ticket)))
                .flatMap(store::saveTicket)
                .onErrorResume(error -> {
                    log.warn("Could not cancel remote ticket {} of request {}: {}",
                        ticket.getExternalId(), request.getId(), messageOf(error));
                    return Mono.empty();
                }))
            .then();
    }

    private Ticket markCancelled(Ticket ticket) {
        Instant now = clock.instant();
        ticket.setStatus(TicketStatus.CANCELLED);
        ticket.setUpdatedInExternalAt(now);
        ticket.recordSyncSuccess(now);
        return ticket;
    }

    private TicketPayload payload(Ticket ticket) {
        Map<String, Object> extra = ticket.getExtraFields() == null
            ? Map.of()
            : new LinkedHashMap<>(ticket.getExtraFields().asMap());
        return new TicketPayload(
            ticket.getTitle(),
            ticket.getDescription(),
            ticket.getPriority(),
            ticket.getCategory(),
            ticket.getSubcategory(),
            ticket.getAssignmentGroup(),
            extra
        );
    }

    private Mono<TaskRequest> loadRequest(UUID requestId) {
        return store.findRequest(requestId)
            .switchIfEmpty(Mono.error(() -> new RequestNotFoundException(requestId)));
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private record TicketSync(Ticket ticket, SyncSummary summary) {
    }
}
