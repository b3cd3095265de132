package com.ticketsync.service;

/**
 * Counts of one sync pass. {@code skipped} tickets had no external id yet.
 */
public record SyncSummary(int synced, int failed, int skipped) {

    public static final SyncSummary EMPTY = new SyncSummary(0, 0, 0);

    public SyncSummary plus(SyncSummary other) {
        return new SyncSummary(synced + other.synced, failed + other.failed, skipped + other.skipped);
    }
}
