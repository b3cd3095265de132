package com.ticketsync.domain;

/**
 * Business priority of a request; tickets inherit it unless they carry their own.
 */
public enum RequestPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
