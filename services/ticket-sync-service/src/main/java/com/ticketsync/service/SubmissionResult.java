package com.ticketsync.service;

import java.util.List;

import com.ticketsync.domain.TaskRequest;
import com.ticketsync.domain.Ticket;

/**
 * State of a request and its tickets after a creation attempt.
 */
public record SubmissionResult(TaskRequest request, List<Ticket> tickets) {

    public SubmissionResult {
        tickets = List.copyOf(tickets);
    }
}
