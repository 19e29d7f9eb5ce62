package com.ai.intake.hours;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Pure checks over a {@link BusinessCalendar}: is a local start time bookable, and when is the
 * next bookable start. No parsing concerns live here.
 */
public class BusinessHoursValidator {

    private final BusinessCalendar calendar;
    private final int stepMinutes;
    private final int lookaheadDays;

    public BusinessHoursValidator(BusinessCalendar calendar, int stepMinutes, int lookaheadDays) {
        if (stepMinutes <= 0 || lookaheadDays <= 0) {
            throw new IllegalArgumentException("stepMinutes and lookaheadDays must be positive");
        }
        this.calendar = calendar;
        this.stepMinutes = stepMinutes;
        this.lookaheadDays = lookaheadDays;
    }

    public BusinessCalendar getCalendar() {
        return calendar;
    }

    /**
     * True when the appointment starts at or after opening and ends no later than closing on the same day.
     */
    public boolean isWithinHours(LocalDateTime local, int durationMinutes) {
        Optional<OpeningHours> hours = calendar.hoursFor(local.getDayOfWeek());
        if (hours.isEmpty()) return false;
        int start = minuteOfDay(local);
        int open = hours.get().open().toSecondOfDay() / 60;
        int close = hours.get().close().toSecondOfDay() / 60;
        return start >= open && start + durationMinutes <= close;
    }

    /**
     * First bookable start at or after {@code afterLocal}, walking forward in {@code stepMinutes}
     * increments. Empty when nothing opens within the lookahead.
     */
    public Optional<LocalDateTime> nextOpening(LocalDateTime afterLocal, int durationMinutes) {
        if (!calendar.hasAnyOpenDay()) return Optional.empty();

        LocalDateTime limit = afterLocal.plusDays(lookaheadDays);
        LocalDateTime candidate = roundUp(afterLocal);

        while (!candidate.isAfter(limit)) {
            Optional<OpeningHours> hours = calendar.hoursFor(candidate.getDayOfWeek());
            if (hours.isEmpty()) {
                candidate = candidate.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (isWithinHours(candidate, durationMinutes)) {
                return Optional.of(candidate);
            }
            LocalDateTime open = candidate.toLocalDate().atTime(hours.get().open());
            if (candidate.isBefore(open)) {
                candidate = open;
            } else if (minuteOfDay(candidate) + durationMinutes > hours.get().close().toSecondOfDay() / 60) {
                candidate = candidate.toLocalDate().plusDays(1).atStartOfDay();
            } else {
                candidate = candidate.plusMinutes(stepMinutes);
            }
        }
        return Optional.empty();
    }

    /**
     * Converts the UTC start into business-local time and checks it.
     */
    public HoursCheck check(Instant startUtc, int durationMinutes) {
        LocalDateTime local = LocalDateTime.ofInstant(startUtc, calendar.getZone());
        if (isWithinHours(local, durationMinutes)) {
            return new HoursCheck(true, local, null);
        }
        return new HoursCheck(false, local, nextOpening(local, durationMinutes).orElse(null));
    }

    private LocalDateTime roundUp(LocalDateTime t) {
        LocalDateTime truncated = t.truncatedTo(ChronoUnit.MINUTES);
        if (truncated.isBefore(t)) truncated = truncated.plusMinutes(1);
        int remainder = minuteOfDay(truncated) % stepMinutes;
        return remainder == 0 ? truncated : truncated.plusMinutes(stepMinutes - remainder);
    }

    private static int minuteOfDay(LocalDateTime t) {
        return t.getHour() * 60 + t.getMinute();
    }

    public record HoursCheck(boolean withinHours, LocalDateTime local, LocalDateTime nextOpening) {
    }
}
