package com.ticketsync.integration;

import java.util.Map;

/**
 * Identifiers assigned by the remote system to a newly created ticket, along with
 * whatever other fields it echoed back.
 */
public record CreatedTicket(String externalId, String referenceNumber, Map<String, Object> fields) {
}
