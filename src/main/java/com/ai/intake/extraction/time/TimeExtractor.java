package com.ai.intake.extraction.time;

import com.ai.intake.client.LlmClient;
import com.ai.intake.config.IntakeProperties;
import com.ai.intake.extraction.ExtractionLayer;
import com.ai.intake.extraction.ExtractionPipeline;
import com.ai.intake.extraction.ExtractionResult;
import com.ai.intake.hours.BusinessCalendar;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Time chain on normalized text: calendar phrases, explicit formats, LLM guess. The local result is taken in the
 * business zone and returned as a future UTC instant; business-hours checks are left to the caller.
 */
@Component
public class TimeExtractor {

    private final Clock clock;
    private final ZoneId zone;
    private final RelativeDayNormalizer normalizer = new RelativeDayNormalizer();
    private final ExtractionPipeline<LocalDateTime> pipeline;

    public TimeExtractor(IntakeProperties properties, BusinessCalendar calendar, LlmClient llm, Clock clock,
                         @Qualifier("extractionExecutor") AsyncTaskExecutor executor) {
        this.clock = clock;
        this.zone = calendar.getZone();

        CalendarPhraseParser phrases = new CalendarPhraseParser(clock, zone);
        GeneralDateTimeParser general = new GeneralDateTimeParser(clock, zone);
        List<ExtractionLayer<LocalDateTime>> layers = new ArrayList<>();
        layers.add(phrases);
        layers.add(general);
        if (properties.getExtraction().isLlmEnabled()) {
            layers.add(new LlmTimeLayer(llm, general, phrases, clock, zone));
        }
        this.pipeline = new ExtractionPipeline<>("time", layers, executor,
                properties.getExtraction().getLayerTimeout());
    }

    public ExtractionResult<Instant> extract(String transcript) {
        if (transcript == null || transcript.isBlank()) {
            return ExtractionResult.failed("empty_input");
        }
        String normalized = normalizer.normalize(transcript, LocalDate.now(clock.withZone(zone)));
        ExtractionResult<LocalDateTime> local = pipeline.run(normalized);
        if (!local.isSuccess()) {
            return ExtractionResult.failed(local.getReason());
        }
        Instant start = local.getValue().atZone(zone).toInstant();
        if (!start.isAfter(clock.instant())) {
            return ExtractionResult.failed("time_in_past");
        }
        return ExtractionResult.success(start, local.getLayer());
    }

    public OptionalInt durationHint(String transcript) {
        return transcript == null ? OptionalInt.empty() : DurationHint.find(transcript);
    }
}
