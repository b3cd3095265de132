package com.ticketsync.web.dto;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import com.ticketsync.domain.RequestPriority;
import com.ticketsync.domain.SyncStatus;
import com.ticketsync.domain.TicketStatus;

/**
 * API view of a ticket, including the link into the ServiceNow UI once it exists.
 */
public class TicketResponse {

    private final UUID id;
    private final UUID requestId;
    private final String externalId;
    private final String referenceNumber;
    private final String url;
    private final String title;
    private final String description;
    private final TicketStatus status;
    private final RequestPriority priority;
    private final String category;
    private final String subcategory;
    private final String assignmentGroup;
    private final String assignedTo;
    private final Map<String, Object> fields;
    private final SyncStatus syncStatus;
    private final String syncError;
    private final Instant lastSyncAt;
    private final Instant closedInExternalAt;
    private final Instant createdAt;
    private final Instant updatedAt;

    public TicketResponse(
        UUID id,
        UUID requestId,
        String externalId,
        String referenceNumber,
        String url,
        String title,
        String description,
        TicketStatus status,
        RequestPriority priority,
        String category,
        String subcategory,
        String assignmentGroup,
        String assignedTo,
        Map<String, Object> fields,
        SyncStatus syncStatus,
        String syncError,
        Instant lastSyncAt,
        Instant closedInExternalAt,
        Instant createdAt,
        Instant updatedAt
    ) {
        this.id = id;
        this.requestId = requestId;
        this.externalId = externalId;
        this.referenceNumber = referenceNumber;
        this.url = url;
        this.title = title;
        this.description = description;
        this.status = status;
        this.priority = priority;
        this.category = category;
        this.subcategory = subcategory;
        this.assignmentGroup = assignmentGroup;
        this.assignedTo = assignedTo;
        this.fields = fields;
        this.syncStatus = syncStatus;
        this.syncError = syncError;
        this.lastSyncAt = lastSyncAt;
        this.closedInExternalAt = closedInExternalAt;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public String getExternalId() {
        return externalId;
    }

    public String getReferenceNumber() {
        return referenceNumber;
    }

    public String getUrl() {
        return url;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public TicketStatus getStatus() {
        return status;
    }

    public RequestPriority getPriority() {
        return priority;
    }

    public String getCategory() {
        return category;
    }

    public String getSubcategory() {
        return subcategory;
    }

    public String getAssignmentGroup() {
        return assignmentGroup;
    }

    public String getAssignedTo() {
        return assignedTo;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public SyncStatus getSyncStatus() {
        return syncStatus;
    }

    public String getSyncError() {
        return syncError;
    }

    public Instant getLastSyncAt() {
        return lastSyncAt;
    }

    public Instant getClosedInExternalAt() {
        return closedInExternalAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
