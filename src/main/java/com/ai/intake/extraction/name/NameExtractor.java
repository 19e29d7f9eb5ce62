package com.ai.intake.extraction.name;

import com.ai.intake.client.EntityRecognizer;
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
 * Name chain: introduction patterns, NER service (when configured), LLM guess.
 */
@Component
public class NameExtractor {

    private final ExtractionPipeline<String> pipeline;

    public NameExtractor(IntakeProperties properties, EntityRecognizer recognizer, LlmClient llm,
                         @Qualifier("extractionExecutor") AsyncTaskExecutor executor) {
        List<ExtractionLayer<String>> layers = new ArrayList<>();
        layers.add(new PatternNameLayer());
        if (recognizer.isEnabled()) {
            layers.add(new NerNameLayer(recognizer, properties.getNer().getTimeout()));
        }
        if (properties.getExtraction().isLlmEnabled()) {
            layers.add(new LlmNameLayer(llm));
        }
        this.pipeline = new ExtractionPipeline<>("name", layers, executor,
                properties.getExtraction().getLayerTimeout());
    }

    public ExtractionResult<String> extract(String transcript) {
        return pipeline.run(transcript);
    }
}
