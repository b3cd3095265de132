package com.ticketsync.repository;

import java.util.Collection;
import java.util.UUID;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.ticketsync.domain.Ticket;

import reactor.core.publisher.Flux;

@Repository
public interface TicketRepository extends ReactiveCrudRepository<Ticket, UUID> {

    Flux<Ticket> findByRequestIdOrderByCreatedAtAsc(UUID requestId);

    @Query("SELECT * FROM tickets WHERE external_id IS NOT NULL AND status IN (:statuses) ORDER BY last_sync_at NULLS FIRST")
    Flux<Ticket> findLinkedTicketsInStatus(Collection<String> statuses);
}
