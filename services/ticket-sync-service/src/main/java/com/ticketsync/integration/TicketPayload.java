package com.ticketsync.integration;

import java.util.Map;

import com.ticketsync.domain.RequestPriority;

/**
 * Data sent to the remote system to open one ticket. {@code extraFields} are passed
 * through as additional top-level fields.
 */
public record TicketPayload(
    String title,
    String description,
    RequestPriority priority,
    String category,
    String subcategory,
    String assignmentGroup,
    Map<String, Object> extraFields
) {

    public TicketPayload {
        extraFields = extraFields == null ? Map.of() : extraFields;
    }
}
