package com.ticketsync.domain;

/**
 * Internal view of the state of an external ticket. Remote state codes are
 * translated into these values by {@code com.ticketsync.service.StatusMapper}.
 */
public enum TicketStatus {
    NEW,
    IN_PROGRESS,
    ON_HOLD,
    RESOLVED,
    CLOSED,
    CANCELLED;

    public boolean isOpen() {
        return this == NEW || this == IN_PROGRESS || this == ON_HOLD;
    }

    public boolean isClosed() {
        return !isOpen();
    }
}
