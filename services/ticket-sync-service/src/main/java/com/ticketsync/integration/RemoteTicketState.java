package com.ticketsync.integration;

import java.time.Instant;

/**
 * Current state of a ticket as reported by the remote system. {@code state} is the
 * raw remote value, either a numeric code or a lowercase name.
 */
public record RemoteTicketState(
    String externalId,
    String referenceNumber,
    String state,
    String assignee,
    Instant openedAt,
    Instant closedAt
) {
}
