package com.ticketsync.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a {@link TaskRequest}.
 *
 * <p>The allowed moves form a small state machine:
 * <pre>
 * PENDING    -> PROCESSING | CANCELLED
 * PROCESSING -> COMPLETED | FAILED | CANCELLED
 * FAILED     -> PENDING (retry) | CANCELLED
 * COMPLETED, CANCELLED: terminal
 * </pre>
 * Values are persisted as plain text.</p>
 */
public enum RequestStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public Set<RequestStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROCESSING, CANCELLED);
            case PROCESSING -> EnumSet.of(COMPLETED, FAILED, CANCELLED);
            case FAILED -> EnumSet.of(PENDING, CANCELLED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(RequestStatus.class);
        };
    }

    public boolean canTransitionTo(RequestStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }
}
