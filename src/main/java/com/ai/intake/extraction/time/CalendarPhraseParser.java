package com.ai.intake.extraction.time;

import com.ai.intake.extraction.ExtractionLayer;
import com.ai.intake.extraction.ExtractionResult;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Month;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Calendar phrases on normalized text: anchored dates, "week of" anchors with a weekday, "next friday",
 * "october 22nd", "22nd of october", "10/22", each combined with a time of day. Relative to the injected clock
 * in the business zone.
 */
public class CalendarPhraseParser implements ExtractionLayer<LocalDateTime> {

    private static final String MONTHS = "(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?"
            + "|aug(?:ust)?|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)";

    private static final Pattern WEEK_OF = Pattern.compile("\\bweek of (\\d{4}-\\d{2}-\\d{2})\\b");
    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");
    private static final Pattern WEEKDAY = Pattern.compile(
            "\\b(?:(next|this|coming) )?(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b");
    private static final Pattern MONTH_DAY = Pattern.compile("\\b" + MONTHS + "\\.? (\\d{1,2})(?:st|nd|rd|th)?\\b");
    private static final Pattern DAY_OF_MONTH = Pattern.compile("\\b(\\d{1,2})(?:st|nd|rd|th)? of " + MONTHS + "\\b");
    private static final Pattern NUMERIC_DATE = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})(?:/(\\d{2}|\\d{4}))?\\b");

    private final Clock clock;
    private final ZoneId zone;

    public CalendarPhraseParser(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    @Override
    public String name() {
        return "calendar_phrase";
    }

    @Override
    public ExtractionResult<LocalDateTime> extract(String normalized) {
        LocalDateTime now = LocalDateTime.now(clock.withZone(zone));
        LocalDate today = now.toLocalDate();
        String text = normalized.toLowerCase(Locale.ROOT);

        Optional<DateHit> date = findDate(text, today);
        String rest = date.map(hit -> hit.blankOut(text)).orElse(text);
        Optional<LocalTime> time = TimeOfDay.find(rest);
        if (time.isEmpty()) {
            return ExtractionResult.failed(date.isPresent() ? "no_time_of_day" : "no_calendar_phrase");
        }
        if (date.isPresent()) {
            LocalDateTime dated = date.get().date().atTime(time.get());
            // "monday at 10" said on a monday after 10 means next week
            if (date.get().bareWeekday() && !dated.isAfter(now)) {
                dated = dated.plusWeeks(1);
            }
            return ExtractionResult.success(dated, name());
        }
        LocalDateTime candidate = today.atTime(time.get());
        if (!candidate.isAfter(now)) {
            candidate = candidate.plusDays(1);
        }
        return ExtractionResult.success(candidate, name());
    }

    private Optional<DateHit> findDate(String text, LocalDate today) {
        Matcher weekOf = WEEK_OF.matcher(text);
        if (weekOf.find()) {
            LocalDate anchor = LocalDate.parse(weekOf.group(1));
            Matcher day = WEEKDAY.matcher(text);
            if (day.find()) {
                LocalDate monday = anchor.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                LocalDate date = monday.plusDays(dayOfWeek(day.group(2)).getValue() - 1L);
                return Optional.of(new DateHit(date, weekOf.start(), weekOf.end(), day.start(), day.end()));
            }
            return Optional.of(new DateHit(anchor, weekOf.start(), weekOf.end(), -1, -1));
        }

        Matcher iso = ISO_DATE.matcher(text);
        if (iso.find()) {
            try {
                return Optional.of(new DateHit(LocalDate.parse(iso.group(1)), iso.start(), iso.end(), -1, -1));
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        }

        Matcher md = MONTH_DAY.matcher(text);
        if (md.find()) {
            return monthDay(today, month(md.group(1)), Integer.parseInt(md.group(2)), null)
                    .map(d -> new DateHit(d, md.start(), md.end(), -1, -1));
        }
        Matcher dm = DAY_OF_MONTH.matcher(text);
        if (dm.find()) {
            return monthDay(today, month(dm.group(2)), Integer.parseInt(dm.group(1)), null)
                    .map(d -> new DateHit(d, dm.start(), dm.end(), -1, -1));
        }
        Matcher numeric = NUMERIC_DATE.matcher(text);
        if (numeric.find()) {
            Integer year = null;
            if (numeric.group(3) != null) {
                int y = Integer.parseInt(numeric.group(3));
                year = y < 100 ? 2000 + y : y;
            }
            int monthValue = Integer.parseInt(numeric.group(1));
            if (monthValue < 1 || monthValue > 12) return Optional.empty();
            Integer fixedYear = year;
            return monthDay(today, Month.of(monthValue), Integer.parseInt(numeric.group(2)), fixedYear)
                    .map(d -> new DateHit(d, numeric.start(), numeric.end(), -1, -1));
        }

        Matcher day = WEEKDAY.matcher(text);
        if (day.find()) {
            DayOfWeek dow = dayOfWeek(day.group(2));
            LocalDate date;
            if ("next".equals(day.group(1))) {
                date = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                        .plusWeeks(1)
                        .plusDays(dow.getValue() - 1L);
            } else {
                date = today.with(TemporalAdjusters.nextOrSame(dow));
            }
            return Optional.of(new DateHit(date, day.start(), day.end(), -1, -1, !"next".equals(day.group(1))));
        }
        return Optional.empty();
    }

    /** Dates without a year roll into next year once this year's date has passed. */
    private static Optional<LocalDate> monthDay(LocalDate today, Month month, int day, Integer year) {
        try {
            if (year != null) {
                return Optional.of(LocalDate.of(year, month, day));
            }
            LocalDate date = LocalDate.of(today.getYear(), month, day);
            return Optional.of(date.isBefore(today) ? date.plusYears(1) : date);
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static DayOfWeek dayOfWeek(String name) {
        return DayOfWeek.valueOf(name.toUpperCase(Locale.ROOT));
    }

    private static Month month(String token) {
        String prefix = token.substring(0, 3).toUpperCase(Locale.ROOT);
        for (Month m : Month.values()) {
            if (m.name().startsWith(prefix)) return m;
        }
        throw new IllegalArgumentException("Unknown month: " + token);
    }

    private record DateHit(LocalDate date, int start, int end, int start2, int end2, boolean bareWeekday) {

        DateHit(LocalDate date, int start, int end, int start2, int end2) {
            this(date, start, end, start2, end2, false);
        }

        String blankOut(String text) {
            StringBuilder sb = new StringBuilder(text);
            blank(sb, start, end);
            if (start2 >= 0) blank(sb, start2, end2);
            return sb.toString();
        }

        private static void blank(StringBuilder sb, int from, int to) {
            for (int i = from; i < to; i++) sb.setCharAt(i, ' ');
        }
    }
}
