package com.ticketsync.service;

import com.ticketsync.domain.TicketStatus;

/**
 * Result of translating a remote state. {@code recognized} is false when the raw
 * value was unknown and {@code status} holds the fallback.
 */
public record StatusMapping(TicketStatus status, String rawState, boolean recognized) {
}
