package com.ticketsync.domain;

/**
 * Outcome of the last exchange with the remote system for a ticket.
 */
public enum SyncStatus {
    SUCCESS,
    FAILED
}
