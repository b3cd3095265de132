package com.ticketsync.web.dto;

public class SyncResponse {

    private final int syncedTickets;
    private final int failedTickets;
    private final int skippedTickets;

    public SyncResponse(int syncedTickets, int failedTickets, int skippedTickets) {
        this.syncedTickets = syncedTickets;
        this.failedTickets = failedTickets;
        this.skippedTickets = skippedTickets;
    }

    public int getSyncedTickets() {
        return syncedTickets;
    }

    public int getFailedTickets() {
        return failedTickets;
    }

    public int getSkippedTickets() {
        return skippedTickets;
    }
}
