package com.ticketsync.service;

import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Exception thrown when a request id does not exist. Spring WebFlux maps it to a
 * 404 response via {@link org.springframework.web.bind.annotation.ResponseStatus}.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class RequestNotFoundException extends RuntimeException {

    public RequestNotFoundException(UUID id) {
        super("Request with id %s not found".formatted(id));
    }
}
