package com.ticketsync.repository;

import java.util.List;
import java.util.UUID;

import com.ticketsync.domain.TaskRequest;
import com.ticketsync.domain.Ticket;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Storage of requests and their tickets as seen by the synchronization engine.
 *
 * <p>Writes are optimistic: saving an entity whose version no longer matches the
 * stored one fails with {@link ConflictException}. Any other storage failure
 * surfaces as {@link PersistenceException}.</p>
 */
public interface TaskRequestStore {

    /**
     * Persists a new request and all of its ticket stubs in one transaction. Either
     * everything is written or nothing is.
     */
    Mono<PersistedRequest> createWithTickets(TaskRequest request, List<Ticket> tickets);

    Mono<TaskRequest> findRequest(UUID requestId);

    Flux<TaskRequest> findRequests(RequestFilter filter);

    Mono<TaskRequest> saveRequest(TaskRequest request);

    Flux<Ticket> findTickets(UUID requestId);

    /**
     * Open tickets that already exist in the remote system, least recently synced first.
     */
    Flux<Ticket> findOpenLinkedTickets();

    Mono<Ticket> saveTicket(Ticket ticket);
}
