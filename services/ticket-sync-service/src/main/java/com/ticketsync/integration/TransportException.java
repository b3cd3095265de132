package com.ticketsync.integration;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The remote system could not be reached or did not answer in time. Transient: the
 * same call may succeed later.
 */
@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class TransportException extends RuntimeException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
