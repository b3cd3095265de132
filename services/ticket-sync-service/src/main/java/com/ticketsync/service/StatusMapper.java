package com.ticketsync.service;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.ticketsync.domain.TicketStatus;

/**
 * Translates remote ticket states into {@link TicketStatus}.
 *
 * <p>Both the numeric codes ({@code "1"} to {@code "6"}) and the lowercase names
 * ({@code "new"}, {@code "in_progress"}, ...) are accepted, ignoring case and
 * surrounding whitespace. Any other value maps to {@link #FALLBACK} and is reported
 * as unrecognized so the caller can keep the raw value; this never throws.</p>
 */
@Component
public class StatusMapper {

    private static final Logger log = LoggerFactory.getLogger(StatusMapper.class);

    public static final TicketStatus FALLBACK = TicketStatus.NEW;

    private static final Map<String, TicketStatus> REMOTE_STATES = Map.ofEntries(
        Map.entry("1", TicketStatus.NEW),
        Map.entry("2", TicketStatus.IN_PROGRESS),
        Map.entry("3", TicketStatus.ON_HOLD),
        Map.entry("4", TicketStatus.RESOLVED),
        Map.entry("5", TicketStatus.CLOSED),
        Map.entry("6", TicketStatus.CANCELLED),
        Map.entry("new", TicketStatus.NEW),
        Map.entry("in_progress", TicketStatus.IN_PROGRESS),
        Map.entry("on_hold", TicketStatus.ON_HOLD),
        Map.entry("resolved", TicketStatus.RESOLVED),
        Map.entry("closed", TicketStatus.CLOSED),
        Map.entry("cancelled", TicketStatus.CANCELLED)
    );

    private static final Map<TicketStatus, String> REMOTE_CODES = new EnumMap<>(Map.of(
        TicketStatus.NEW, "1",
        TicketStatus.IN_PROGRESS, "2",
        TicketStatus.ON_HOLD, "3",
        TicketStatus.RESOLVED, "4",
        TicketStatus.CLOSED, "5",
        TicketStatus.CANCELLED, "6"
    ));

    public StatusMapping map(String rawState) {
        String key = rawState == null ? "" : rawState.trim().toLowerCase(Locale.ROOT);
        TicketStatus status = REMOTE_STATES.get(key);
        if (status == null) {
            log.warn("Unmapped remote ticket state '{}', falling back to {}", rawState, FALLBACK);
            return new StatusMapping(FALLBACK, rawState, false);
        }
        return new StatusMapping(status, rawState, true);
    }

    public String toRemoteCode(TicketStatus status) {
        return REMOTE_CODES.get(status);
    }
}
