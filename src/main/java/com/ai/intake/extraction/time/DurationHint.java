package com.ai.intake.extraction.time;

import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Appointment length mentioned alongside the time: "for an hour", "45 minutes", "an hour and a half".
 * "in 2 hours" is a start time, not a length.
 */
public final class DurationHint {

    private static final Pattern HOUR_AND_HALF = Pattern.compile("\\b(?:an|one|1) hour and a half\\b|\\b90 min");
    private static final Pattern HALF_HOUR = Pattern.compile("\\bhalf (?:an )?hour\\b");
    private static final Pattern HOURS = Pattern.compile(
            "\\b(?:for|takes?|lasts?|need|needs) (?:about |around )?(an|one|two|three|\\d) hours?\\b");
    private static final Pattern MINUTES = Pattern.compile("(?<!\\bin )\\b(\\d{2,3}|fifteen|twenty|thirty|forty[- ]five|sixty) ?(?:minutes?|mins?)\\b");

    private DurationHint() {
    }

    public static OptionalInt find(String transcript) {
        String text = transcript.toLowerCase(Locale.ROOT);
        if (HOUR_AND_HALF.matcher(text).find()) return OptionalInt.of(90);
        if (HALF_HOUR.matcher(text).find()) return OptionalInt.of(30);

        Matcher m = MINUTES.matcher(text);
        if (m.find()) {
            int minutes = switch (m.group(1).replace('-', ' ')) {
                case "fifteen" -> 15;
                case "twenty" -> 20;
                case "thirty" -> 30;
                case "forty five" -> 45;
                case "sixty" -> 60;
                default -> Integer.parseInt(m.group(1));
            };
            return minutes >= 15 && minutes <= 240 ? OptionalInt.of(minutes) : OptionalInt.empty();
        }
        m = HOURS.matcher(text);
        if (m.find()) {
            int hours = switch (m.group(1)) {
                case "an", "one" -> 1;
                case "two" -> 2;
                case "three" -> 3;
                default -> Integer.parseInt(m.group(1));
            };
            return hours >= 1 && hours <= 4 ? OptionalInt.of(hours * 60) : OptionalInt.empty();
        }
        return OptionalInt.empty();
    }
}
