package com.ai.intake.extraction.time;

import com.ai.intake.extraction.ExtractionLayer;
import com.ai.intake.extraction.ExtractionResult;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Explicit date-time formats: ISO-8601 local or offset, "october 22 2:30 pm", "10/22/2026 2 pm" and similar.
 */
public class GeneralDateTimeParser implements ExtractionLayer<LocalDateTime> {

    private static final List<String> WITH_YEAR = List.of(
            "uuuu-MM-dd HH:mm",
            "uuuu-MM-dd h:mm a",
            "uuuu-MM-dd h a",
            "MMMM d uuuu h:mm a",
            "MMMM d, uuuu h:mm a",
            "MMMM d uuuu h a",
            "MMMM d, uuuu 'at' h:mm a",
            "EEEE, MMMM d, uuuu h:mm a",
            "M/d/uuuu h:mm a",
            "M/d/uuuu h a",
            "M/d/uuuu HH:mm");

    private static final List<String> WITHOUT_YEAR = List.of(
            "MMMM d h:mm a",
            "MMMM d h a",
            "MMMM d 'at' h:mm a",
            "MMMM d 'at' h a",
            "MMM d h:mm a",
            "MMM d h a",
            "M/d h:mm a",
            "M/d h a");

    private final Clock clock;
    private final ZoneId zone;

    public GeneralDateTimeParser(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    @Override
    public String name() {
        return "general_datetime";
    }

    @Override
    public ExtractionResult<LocalDateTime> extract(String transcript) {
        String text = transcript.trim().replaceAll("[.!?]+$", "").replaceAll("(\\d)(st|nd|rd|th)\\b", "$1");

        Optional<LocalDateTime> parsed = tryParse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                .or(() -> tryParseOffset(text));
        for (Iterator<String> it = WITH_YEAR.iterator(); parsed.isEmpty() && it.hasNext(); ) {
            parsed = tryParse(text, formatter(it.next(), null));
        }
        if (parsed.isPresent()) {
            return ExtractionResult.success(parsed.get(), name());
        }

        LocalDate today = LocalDate.now(clock.withZone(zone));
        for (String pattern : WITHOUT_YEAR) {
            Optional<LocalDateTime> noYear = tryParse(text, formatter(pattern, today.getYear()));
            if (noYear.isPresent()) {
                LocalDateTime value = noYear.get();
                return ExtractionResult.success(value.toLocalDate().isBefore(today) ? value.plusYears(1) : value, name());
            }
        }
        return ExtractionResult.failed("no_known_format");
    }

    private Optional<LocalDateTime> tryParseOffset(String text) {
        try {
            OffsetDateTime offset = OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
            return Optional.of(offset.atZoneSameInstant(zone).toLocalDateTime());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDateTime> tryParse(String text, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDateTime.parse(text, formatter));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter formatter(String pattern, Integer defaultYear) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern);
        if (defaultYear != null) {
            builder.parseDefaulting(ChronoField.YEAR, defaultYear);
        }
        return builder.toFormatter(Locale.ENGLISH);
    }
}
