package com.ticketsync.domain;

import java.time.Instant;

/**
 * Guarded status transitions for {@link TaskRequest}.
 *
 * <p>Each method validates the move against {@link RequestStatus#allowedTransitions()}
 * before touching any field, so a rejected transition leaves the request exactly as
 * it was. Timestamps are stamped with the instant passed in by the caller.</p>
 */
public final class RequestLifecycle {

    private RequestLifecycle() {
    }

    public static void startProcessing(TaskRequest request, Instant now) {
        require(request, RequestStatus.PROCESSING, "only pending requests can start processing");
        request.setStatus(RequestStatus.PROCESSING);
        request.setProcessingStarted(now);
        request.setUpdatedAt(now);
    }

    public static void complete(TaskRequest request, Instant now) {
        require(request, RequestStatus.COMPLETED, "only processing requests can complete");
        request.setStatus(RequestStatus.COMPLETED);
        request.setFailureReason(null);
        request.setProcessingCompleted(now);
        request.setActualCompletion(now);
        request.setUpdatedAt(now);
    }

    public static void fail(TaskRequest request, String reason, Instant now) {
        require(request, RequestStatus.FAILED, "only processing requests can fail");
        request.setStatus(RequestStatus.FAILED);
        request.setFailureReason(reason == null || reason.isBlank() ? "Unknown failure" : reason);
        request.setProcessingCompleted(now);
        request.setUpdatedAt(now);
    }

    /**
     * Moves a failed request back to PENDING and consumes one retry.
     */
    public static void prepareRetry(TaskRequest request, Instant now) {
        if (!request.canRetry()) {
            String detail = request.isFailed()
                ? "retry limit of %d reached".formatted(request.getMaxRetries())
                : "only failed requests can be retried";
            throw new InvalidTransitionException(request.getId(), request.getStatus(), RequestStatus.PENDING, detail);
        }
        request.setStatus(RequestStatus.PENDING);
        request.setRetryCount(request.getRetryCount() + 1);
        request.setProcessingStarted(null);
        request.setProcessingCompleted(null);
        request.setActualCompletion(null);
        request.setFailureReason(null);
        request.setUpdatedAt(now);
    }

    public static void cancel(TaskRequest request, Instant now) {
        require(request, RequestStatus.CANCELLED, "completed and cancelled requests are final");
        request.setStatus(RequestStatus.CANCELLED);
        request.setProcessingCompleted(now);
        request.setUpdatedAt(now);
    }

    private static void require(TaskRequest request, RequestStatus target, String detail) {
        RequestStatus current = request.getStatus();
        if (current == null || !current.canTransitionTo(target)) {
            throw new InvalidTransitionException(request.getId(), current, target, detail);
        }
    }
}
