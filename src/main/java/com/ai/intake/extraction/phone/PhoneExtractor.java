package com.ai.intake.extraction.phone;

import com.ai.intake.client.LlmClient;
import com.ai.intake.config.IntakeProperties;
import com.ai.intake.extraction.ExtractionLayer;
import com.ai.intake.extraction.ExtractionPipeline;
import com.ai.intake.extraction.ExtractionResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Phone number chain: digit pattern, spelled digits, region validation, LLM guess. Output is E.164.
 */
@Component
public class PhoneExtractor {

    private final ExtractionPipeline<String> pipeline;

    public PhoneExtractor(IntakeProperties properties, LlmClient llm,
                          @Qualifier("extractionExecutor") AsyncTaskExecutor executor) {
        PhoneNumbers phoneNumbers = new PhoneNumbers(properties.getPhone().getDefaultRegion());
        DigitPatternLayer digits = new DigitPatternLayer(phoneNumbers);
        RegionValidationLayer region = new RegionValidationLayer(phoneNumbers);

        List<ExtractionLayer<String>> layers = new ArrayList<>();
        layers.add(digits);
        layers.add(new SpelledDigitsLayer(digits));
        layers.add(region);
        if (properties.getExtraction().isLlmEnabled()) {
            layers.add(new LlmPhoneLayer(llm, region));
        }
        this.pipeline = new ExtractionPipeline<>("phone", layers, executor,
                properties.getExtraction().getLayerTimeout());
    }

    public ExtractionResult<String> extract(String transcript) {
        return pipeline.run(transcript);
    }
}
