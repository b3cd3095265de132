package com.ticketsync.integration;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Port to the external ticketing system.
 *
 * <p>Implementations apply a fixed timeout to every call and never retry: a failed
 * call surfaces as {@link TransportException} or {@link RemoteRejectionException} and
 * the caller decides what to do with it.</p>
 */
public interface TicketingClient {

    Mono<CreatedTicket> createTicket(TicketPayload payload);

    /**
     * Creates several tickets in one call. The returned list has one entry per
     * payload, in the same order; individual entries may have failed.
     */
    Mono<List<BatchItemResult>> createTickets(List<TicketPayload> payloads);

    Mono<RemoteTicketState> fetchStatus(String externalId);

    Mono<Void> updateStatus(String externalId, String state, Map<String, Object> extraFields);

    /**
     * Connectivity probe. Completes with {@code false} instead of erroring.
     */
    Mono<Boolean> healthCheck();
}
