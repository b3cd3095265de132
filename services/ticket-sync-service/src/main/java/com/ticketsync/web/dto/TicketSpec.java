package com.ticketsync.web.dto;

import java.util.Map;

import com.ticketsync.domain.RequestPriority;

import jakarta.validation.constraints.Size;

/**
 * One desired ticket of a submission. Blank title, description and priority fall
 * back to the request's own values; {@code fields} are passed to the remote system
 * as additional ticket fields.
 */
public class TicketSpec {

    @Size(max = 255)
    private String title;

    private String description;

    private RequestPriority priority;

    @Size(max = 100)
    private String category;

    @Size(max = 100)
    private String subcategory;

    @Size(max = 100)
    private String assignmentGroup;

    private Map<String, Object> fields;

    public TicketSpec() {
    }

    public TicketSpec(String title) {
        this.title = title;
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

    public Map<String, Object> getFields() {
        return fields;
    }

    public void setFields(Map<String, Object> fields) {
        this.fields = fields;
    }
}
