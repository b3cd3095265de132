package com.ticketsync.integration;

/**
 * Outcome of one item of a batch create. Exactly one of {@code ticket} and
 * {@code error} is set.
 */
public record BatchItemResult(CreatedTicket ticket, String error) {

    public static BatchItemResult success(CreatedTicket ticket) {
        return new BatchItemResult(ticket, null);
    }

    public static BatchItemResult failure(String error) {
        return new BatchItemResult(null, error);
    }

    public boolean isSuccess() {
        return ticket != null;
    }
}
