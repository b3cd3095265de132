package com.ticketsync.web.dto;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import com.ticketsync.domain.RequestPriority;
import com.ticketsync.domain.RequestStatus;

/**
 * API view of a task request.
 */
public class TaskRequestResponse {

    private final UUID id;
    private final String ownerId;
    private final String title;
    private final String description;
    private final String businessTaskType;
    private final RequestStatus status;
    private final RequestPriority priority;
    private final Map<String, Object> payload;
    private final int retryCount;
    private final int maxRetries;
    private final boolean retryable;
    private final String failureReason;
    private final Instant processingStarted;
    private final Instant processingCompleted;
    private final Long processingTimeMillis;
    private final Instant estimatedCompletion;
    private final Instant actualCompletion;
    private final Instant createdAt;
    private final Instant updatedAt;

    public TaskRequestResponse(
        UUID id,
        String ownerId,
        String title,
        String description,
        String businessTaskType,
        RequestStatus status,
        RequestPriority priority,
        Map<String, Object> payload,
        int retryCount,
        int maxRetries,
        boolean retryable,
        String failureReason,
        Instant processingStarted,
        Instant processingCompleted,
        Long processingTimeMillis,
        Instant estimatedCompletion,
        Instant actualCompletion,
        Instant createdAt,
        Instant updatedAt
    ) {
        this.id = id;
        this.ownerId = ownerId;
        this.title = title;
        this.description = description;
        this.businessTaskType = businessTaskType;
        this.status = status;
        this.priority = priority;
        this.payload = payload;
        this.retryCount = retryCount;
        this.maxRetries = maxRetries;
        this.retryable = retryable;
        this.failureReason = failureReason;
        this.processingStarted = processingStarted;
        this.processingCompleted = processingCompleted;
        this.processingTimeMillis = processingTimeMillis;
        this.estimatedCompletion = estimatedCompletion;
        this.actualCompletion = actualCompletion;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public UUID getId() {
        return id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getBusinessTaskType() {
        return businessTaskType;
    }

    public RequestStatus getStatus() {
        return status;
    }

    public RequestPriority getPriority() {
        return priority;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Instant getProcessingStarted() {
        return processingStarted;
    }

    public Instant getProcessingCompleted() {
        return processingCompleted;
    }

    public Long getProcessingTimeMillis() {
        return processingTimeMillis;
    }

    public Instant getEstimatedCompletion() {
        return estimatedCompletion;
    }

    public Instant getActualCompletion() {
        return actualCompletion;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
