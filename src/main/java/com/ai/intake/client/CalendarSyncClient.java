package com.ai.intake.client;

import java.time.Instant;
import java.util.Optional;

/**
 * Pushes booked appointments to an external calendar.
 */
public interface CalendarSyncClient {

    boolean isEnabled();

    /**
     * @return the external event id, or empty when sync is disabled
     */
    Optional<String> createEvent(CalendarEvent event);

    record CalendarEvent(String title, String description, Instant startUtc, int durationMinutes, String sourceCallId) {
    }
}
