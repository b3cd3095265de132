package com.ticketsync.web.dto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.ticketsync.domain.RequestPriority;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Payload received when a task request should be submitted. Each entry of
 * {@code tickets} becomes one ticket in the external system.
 */
public class TaskRequestSubmission {

    @NotBlank
    @Size(max = 255)
    private String title;

    private String description;

    @Size(max = 100)
    private String businessTaskType;

    private RequestPriority priority;

    private Map<String, Object> payload;

    private Instant estimatedCompletion;

    @Valid
    private List<TicketSpec> tickets = new ArrayList<>();

    public TaskRequestSubmission() {
    }

    public TaskRequestSubmission(
        String title,
        String description,
        String businessTaskType,
        RequestPriority priority,
        Map<String, Object> payload,
        List<TicketSpec> tickets
    ) {
        this.title = title;
        this.description = description;
        this.businessTaskType = businessTaskType;
        this.priority = priority;
        this.payload = payload;
        this.tickets = tickets;
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

    public RequestPriority getPriority() {
        return priority;
    }

    public void setPriority(RequestPriority priority) {
        this.priority = priority;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
    }

    public Instant getEstimatedCompletion() {
        return estimatedCompletion;
    }

    public void setEstimatedCompletion(Instant estimatedCompletion) {
        this.estimatedCompletion = estimatedCompletion;
    }

    public List<TicketSpec> getTickets() {
        return tickets;
    }

    public void setTickets(List<TicketSpec> tickets) {
        this.tickets = tickets;
    }
}
