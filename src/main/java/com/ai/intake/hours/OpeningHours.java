package com.ai.intake.hours;

import java.time.LocalTime;

/**
 * Open window for a single day. {@code close} is exclusive for the end of an appointment.
 */
public record OpeningHours(LocalTime open, LocalTime close) {

    public OpeningHours {
        if (open == null || close == null || !open.isBefore(close)) {
            throw new IllegalArgumentException("Opening hours must satisfy open < close: " + open + "-" + close);
        }
    }

    /**
     * Parses "09:00-17:00". Returns null for "closed" or blank.
     */
    public static OpeningHours parse(String window) {
        if (window == null || window.isBlank() || window.trim().equalsIgnoreCase("closed")) {
            return null;
        }
        String[] parts = window.trim().split("-");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected HH:mm-HH:mm but got: " + window);
        }
        return new OpeningHours(LocalTime.parse(parts[0].trim()), LocalTime.parse(parts[1].trim()));
    }
}
