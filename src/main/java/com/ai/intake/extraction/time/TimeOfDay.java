package com.ai.intake.extraction.time;

import java.time.LocalTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the time of day in normalized text: "9:30 am", "2 pm", "14:00", "half past 2", "at 3", "noon", "morning".
 */
final class TimeOfDay {

    private static final Pattern MERIDIEM = Pattern.compile("\\b(\\d{1,2})(?:[:.](\\d{2}))?\\s*(am|pm)\\b");
    private static final Pattern TWENTY_FOUR = Pattern.compile("\\b([01]?\\d|2[0-3]):([0-5]\\d)\\b");
    private static final Pattern HALF_PAST = Pattern.compile("\\bhalf past (\\d{1,2})\\b");
    private static final Pattern QUARTER = Pattern.compile("\\bquarter (past|to) (\\d{1,2})\\b");
    private static final Pattern AT_HOUR = Pattern.compile("\\b(?:at|around|by) (\\d{1,2})\\b");
    private static final Pattern NAMED = Pattern.compile("\\b(noon|morning|afternoon|evening)\\b");

    private TimeOfDay() {
    }

    static Optional<LocalTime> find(String text) {
        Matcher m = MERIDIEM.matcher(text);
        if (m.find()) {
            int hour = Integer.parseInt(m.group(1));
            int minute = m.group(2) != null ? Integer.parseInt(m.group(2)) : 0;
            if (hour < 1 || hour > 12 || minute > 59) return Optional.empty();
            hour = hour % 12 + (m.group(3).equals("pm") ? 12 : 0);
            return Optional.of(LocalTime.of(hour, minute));
        }
        m = TWENTY_FOUR.matcher(text);
        if (m.find()) {
            int hour = Integer.parseInt(m.group(1));
            return Optional.of(LocalTime.of(hour < 7 && hour > 0 ? hour + 12 : hour, Integer.parseInt(m.group(2))));
        }
        m = HALF_PAST.matcher(text);
        if (m.find()) {
            return guessHour(Integer.parseInt(m.group(1))).map(t -> t.plusMinutes(30));
        }
        m = QUARTER.matcher(text);
        if (m.find()) {
            Optional<LocalTime> hour = guessHour(Integer.parseInt(m.group(2)));
            return m.group(1).equals("past")
                    ? hour.map(t -> t.plusMinutes(15))
                    : hour.map(t -> t.minusMinutes(15));
        }
        m = AT_HOUR.matcher(text);
        if (m.find()) {
            return guessHour(Integer.parseInt(m.group(1)));
        }
        m = NAMED.matcher(text);
        if (m.find()) {
            return Optional.of(switch (m.group(1)) {
                case "noon" -> LocalTime.NOON;
                case "morning" -> LocalTime.of(9, 0);
                case "afternoon" -> LocalTime.of(14, 0);
                default -> LocalTime.of(17, 0);
            });
        }
        return Optional.empty();
    }

    /** Bare hours without am/pm: 7-11 morning, 12 noon, 1-6 afternoon; 13-23 taken as given. */
    private static Optional<LocalTime> guessHour(int hour) {
        if (hour >= 1 && hour <= 6) return Optional.of(LocalTime.of(hour + 12, 0));
        if (hour >= 7 && hour <= 23) return Optional.of(LocalTime.of(hour, 0));
        return Optional.empty();
    }
}
