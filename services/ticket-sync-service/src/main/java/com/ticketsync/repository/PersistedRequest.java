package com.ticketsync.repository;

import java.util.List;

import com.ticketsync.domain.TaskRequest;
import com.ticketsync.domain.Ticket;

/**
 * A request together with its ticket stubs, as written by one atomic create.
 */
public record PersistedRequest(TaskRequest request, List<Ticket> tickets) {

    public PersistedRequest {
        tickets = List.copyOf(tickets);
    }
}
