package com.ai.intake.service;

import com.ai.intake.entity.Appointment;

/**
 * Finalizer outcome. {@code EXISTING} means the call had already booked and that appointment is returned.
 */
public record BookingResult(Outcome outcome, Appointment appointment, String reason) {

    public enum Outcome { CREATED, EXISTING, FAILED }

    public static BookingResult created(Appointment appointment) {
        return new BookingResult(Outcome.CREATED, appointment, null);
    }

    public static BookingResult existing(Appointment appointment) {
        return new BookingResult(Outcome.EXISTING, appointment, null);
    }

    public static BookingResult failed(String reason) {
        return new BookingResult(Outcome.FAILED, null, reason);
    }

    public boolean success() {
        return outcome != Outcome.FAILED;
    }
}
