package com.ticketsync.integration;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The remote system answered but refused the call, typically because it rejected
 * one of the submitted fields.
 */
@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class RemoteRejectionException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;

    public RemoteRejectionException(String message, int statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
