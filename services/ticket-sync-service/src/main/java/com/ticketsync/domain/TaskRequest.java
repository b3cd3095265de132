package com.ticketsync.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Persistent representation of an internally submitted business task.
 *
 * <p>A request owns one or more {@link Ticket}s that are created in the external
 * ticketing system on its behalf. Status changes go through {@link RequestLifecycle};
 * the setters exist for Spring Data and should not be used to move the status.</p>
 */
@Table("task_requests")
public class TaskRequest {

    public static final int DEFAULT_MAX_RETRIES = 3;

    @Id
    private UUID id;

    @Column("owner_id")
    private String ownerId;

    private String title;

    private String description;

    @Column("business_task_type")
    private String businessTaskType;

    private RequestStatus status;

    private RequestPriority priority;

    private Attributes payload;

    @Column("retry_count")
    private int retryCount;

    @Column("max_retries")
    private int maxRetries;

    @Column("failure_reason")
    private String failureReason;

    @Column("processing_started")
    private Instant processingStarted;

    @Column("processing_completed")
    private Instant processingCompleted;

    @Column("estimated_completion")
    private Instant estimatedCompletion;

    @Column("actual_completion")
    private Instant actualCompletion;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    public TaskRequest() {
        // default constructor required by Spring Data
    }

    public static TaskRequest newRequest(
        String ownerId,
        String title,
        String description,
        String businessTaskType,
        RequestPriority priority,
        Attributes payload,
        int maxRetries,
        Instant now
    ) {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(title, "title must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        TaskRequest request = new TaskRequest();
        request.id = UUID.randomUUID();
        request.ownerId = ownerId;
        request.title = title;
        request.description = description;
        request.businessTaskType = businessTaskType;
        request.status = RequestStatus.PENDING;
        request.priority = priority == null ? RequestPriority.MEDIUM : priority;
        request.payload = payload == null ? Attributes.empty() : payload;
        request.retryCount = 0;
        request.maxRetries = maxRetries;
        request.createdAt = now;
        request.updatedAt = now;
        return request;
    }

    public boolean isCompleted() {
        return status == RequestStatus.COMPLETED;
    }

    public boolean isFailed() {
        return status == RequestStatus.FAILED;
    }

    public boolean canRetry() {
        return isFailed() && retryCount < maxRetries;
    }

    public boolean canCancel() {
        return status != null && status.canTransitionTo(RequestStatus.CANCELLED);
    }

    public Optional<Duration> processingTime() {
        if (processingStarted == null || processingCompleted == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(processingStarted, processingCompleted));
    }

    public Optional<Duration> totalProcessingTime() {
        if (createdAt == null || actualCompletion == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(createdAt, actualCompletion));
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
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

    public String getBusinessTaskType() {
        return businessTaskType;
    }

    public void setBusinessTaskType(String businessTaskType) {
        this.businessTaskType = businessTaskType;
    }

    public RequestStatus getStatus() {
        return status;
    }

    public void setStatus(RequestStatus status) {
        this.status = status;
    }

    public RequestPriority getPriority() {
        return priority;
    }

    public void setPriority(RequestPriority priority) {
        this.priority = priority;
    }

    public Attributes getPayload() {
        return payload;
    }

    public void setPayload(Attributes payload) {
        this.payload = payload;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }

    public Instant getProcessingStarted() {
        return processingStarted;
    }

    public void setProcessingStarted(Instant processingStarted) {
        this.processingStarted = processingStarted;
    }

    public Instant getProcessingCompleted() {
        return processingCompleted;
    }

    public void setProcessingCompleted(Instant processingCompleted) {
        this.processingCompleted = processingCompleted;
    }

    public Instant getEstimatedCompletion() {
        return estimatedCompletion;
    }

    public void setEstimatedCompletion(Instant estimatedCompletion) {
        this.estimatedCompletion = estimatedCompletion;
    }

    public Instant getActualCompletion() {
        return actualCompletion;
    }

    public void setActualCompletion(Instant actualCompletion) {
        this.actualCompletion = actualCompletion;
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
