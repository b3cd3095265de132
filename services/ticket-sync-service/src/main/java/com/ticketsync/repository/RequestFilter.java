package com.ticketsync.repository;

import java.util.Objects;

import com.ticketsync.domain.RequestPriority;
import com.ticketsync.domain.RequestStatus;

/**
 * Selection of requests owned by one principal. {@code status} and {@code priority}
 * are optional; pages are zero-based.
 */
public record RequestFilter(String ownerId, RequestStatus status, RequestPriority priority, int page, int size) {

    public RequestFilter {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        if (page < 0) {
            throw new IllegalArgumentException("page must not be negative");
        }
        if (size < 1) {
            throw new IllegalArgumentException("size must be positive");
        }
    }

    public long offset() {
        return (long) page * size;
    }
}
