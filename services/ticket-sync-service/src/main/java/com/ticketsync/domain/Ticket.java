package com.ticketsync.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Local record of one work item in the external ticketing system.
 *
 * <p>A ticket starts as a stub owned by a {@link TaskRequest}. The external id and
 * the external reference number are assigned together by {@link #markCreated} once
 * the remote system accepted the ticket; until then both are {@code null}. Tickets
 * are updated by later syncs and never deleted.</p>
 */
@Table("tickets")
public class Ticket {

    @Id
    private UUID id;

    @Column("request_id")
    private UUID requestId;

    @Column("external_id")
    private String externalId;

    @Column("reference_number")
    private String referenceNumber;

    private String title;

    private String description;

    private TicketStatus status;

    private RequestPriority priority;

    private String category;

    private String subcategory;

    @Column("assignment_group")
    private String assignmentGroup;

    @Column("assigned_to")
    private String assignedTo;

    @Column("extra_fields")
    private Attributes extraFields;

    @Column("last_sync_at")
    private Instant lastSyncAt;

    @Column("sync_status")
    private SyncStatus syncStatus;

    @Column("sync_error")
    private String syncError;

    @Column("created_in_external_at")
    private Instant createdInExternalAt;

    @Column("updated_in_external_at")
    private Instant updatedInExternalAt;

    @Column("closed_in_external_at")
    private Instant closedInExternalAt;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    public Ticket() {
        // default constructor required by Spring Data
    }

    public static Ticket stub(
        UUID requestId,
        String title,
        String description,
        RequestPriority priority,
        String category,
        String subcategory,
        String assignmentGroup,
        Attributes extraFields,
        Instant now
    ) {
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Ticket ticket = new Ticket();
        ticket.id = UUID.randomUUID();
        ticket.requestId = requestId;
        ticket.title = title;
        ticket.description = description;
        ticket.status = TicketStatus.NEW;
        ticket.priority = priority == null ? RequestPriority.MEDIUM : priority;
        ticket.category = category;
        ticket.subcategory = subcategory;
        ticket.assignmentGroup = assignmentGroup;
        ticket.extraFields = extraFields == null ? Attributes.empty() : extraFields;
        ticket.createdAt = now;
        ticket.updatedAt = now;
        return ticket;
    }

    public boolean isCreatedExternally() {
        return externalId != null;
    }

    public boolean isOpen() {
        return status != null && status.isOpen();
    }

    public boolean isClosed() {
        return status != null && status.isClosed();
    }

    public boolean needsSync(Instant now, Duration threshold) {
        return lastSyncAt == null || lastSyncAt.isBefore(now.minus(threshold));
    }

    /**
     * Records a successful creation in the remote system. Both identifiers are
     * required; a ticket is never half-linked.
     */
    public void markCreated(String externalId, String referenceNumber, Instant now) {
        if (externalId == null || externalId.isBlank() || referenceNumber == null || referenceNumber.isBlank()) {
            throw new IllegalArgumentException("externalId and referenceNumber must both be set");
        }
        if (this.externalId != null) {
            throw new IllegalStateException("Ticket %s is already linked to %s".formatted(id, this.externalId));
        }
        this.externalId = externalId;
        this.referenceNumber = referenceNumber;
        this.status = TicketStatus.NEW;
        this.createdInExternalAt = now;
        recordSyncSuccess(now);
    }

    public void putExtraField(String key, Object value) {
        if (extraFields == null) {
            extraFields = Attributes.empty();
        }
        extraFields.put(key, value);
    }

    public void recordSyncSuccess(Instant now) {
        this.syncStatus = SyncStatus.SUCCESS;
        this.syncError = null;
        this.lastSyncAt = now;
        this.updatedAt = now;
    }

    public void recordSyncFailure(String error, Instant now) {
        this.syncStatus = SyncStatus.FAILED;
        this.syncError = error;
        this.lastSyncAt = now;
        this.updatedAt = now;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public void setRequestId(UUID requestId) {
        this.requestId = requestId;
    }

    public String getExternalId() {
        return externalId;
    }

    public void setExternalId(String externalId) {
        this.externalId = externalId;
    }

    public String getReferenceNumber() {
        return referenceNumber;
    }

    public void setReferenceNumber(String referenceNumber) {
        this.referenceNumber = referenceNumber;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public TicketStatus getStatus() {
        return status;
    }

    public void setStatus(TicketStatus status) {
        this.status = status;
    }

    public RequestPriority getPriority() {
        return priority;
    }

    public void setPriority(RequestPriority priority) {
        this.priority = priority;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getSubcategory() {
        return subcategory;
    }

    public void setSubcategory(String subcategory) {
        this.subcategory = subcategory;
    }

    public String getAssignmentGroup() {
        return assignmentGroup;
    }

    public void setAssignmentGroup(String assignmentGroup) {
        this.assignmentGroup = assignmentGroup;
    }

    public String getAssignedTo() {
        return assignedTo;
    }

    public void setAssignedTo(String assignedTo) {
        this.assignedTo = assignedTo;
    }

    public Attributes getExtraFields() {
        return extraFields;
    }

    public void setExtraFields(Attributes extraFields) {
        this.extraFields = extraFields;
    }

    public Instant getLastSyncAt() {
        return lastSyncAt;
    }

    public void setLastSyncAt(Instant lastSyncAt) {
        this.lastSyncAt = lastSyncAt;
    }

    public SyncStatus getSyncStatus() {
        return syncStatus;
    }

    public void setSyncStatus(SyncStatus syncStatus) {
        this.syncStatus = syncStatus;
    }

    public String getSyncError() {
        return syncError;
    }

    public void setSyncError(String syncError) {
        this.syncError = syncError;
    }

    public Instant getCreatedInExternalAt() {
        return createdInExternalAt;
    }

    public void setCreatedInExternalAt(Instant createdInExternalAt) {
        this.createdInExternalAt = createdInExternalAt;
    }

    public Instant getUpdatedInExternalAt() {
        return updatedInExternalAt;
    }

    public void setUpdatedInExternalAt(Instant updatedInExternalAt) {
        this.updatedInExternalAt = updatedInExternalAt;
    }

    public Instant getClosedInExternalAt() {
        return closedInExternalAt;
    }

    public void setClosedInExternalAt(Instant closedInExternalAt) {
        this.closedInExternalAt = closedInExternalAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
}
