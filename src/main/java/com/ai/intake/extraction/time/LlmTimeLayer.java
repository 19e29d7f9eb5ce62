package com.ai.intake.extraction.time;

import com.ai.intake.client.LlmClient;
import com.ai.intake.extraction.ExtractionLayer;
import com.ai.intake.extraction.ExtractionResult;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Asks the LLM for an ISO-8601 local date-time, then re-parses the answer with the deterministic parsers.
 */
public class LlmTimeLayer implements ExtractionLayer<LocalDateTime> {

    private final LlmClient llm;
    private final GeneralDateTimeParser general;
    private final CalendarPhraseParser calendar;
    private final Clock clock;
    private final ZoneId zone;

    public LlmTimeLayer(LlmClient llm, GeneralDateTimeParser general, CalendarPhraseParser calendar,
                        Clock clock, ZoneId zone) {
        this.llm = llm;
        this.general = general;
        this.calendar = calendar;
        this.clock = clock;
        this.zone = zone;
    }

    @Override
    public String name() {
        return "llm";
    }

    @Override
    public boolean isExternal() {
        return true;
    }

    @Override
    public ExtractionResult<LocalDateTime> extract(String transcript) {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        String instruction = "Today is " + today.getDayOfWeek() + " " + today + " in time zone " + zone + ". "
                + "The caller was asked when they want an appointment. Reply with only the requested local "
                + "date and time as ISO-8601 (yyyy-MM-ddTHH:mm). Reply NONE if no date and time was given.";
        Optional<String> answer = llm.complete(instruction, transcript);
        if (answer.isEmpty() || answer.get().trim().equalsIgnoreCase("NONE")) {
            return ExtractionResult.failed("llm_no_guess");
        }
        String guess = answer.get().trim();
        ExtractionResult<LocalDateTime> parsed = general.extract(guess);
        if (!parsed.isSuccess()) {
            parsed = calendar.extract(guess);
        }
        return parsed.isSuccess()
                ? ExtractionResult.success(parsed.getValue(), name())
                : ExtractionResult.failed("llm_guess_unparseable");
    }
}
