package com.ai.intake.extraction.name;

import com.ai.intake.client.EntityRecognizer;
import com.ai.intake.extraction.ExtractionLayer;
import com.ai.intake.extraction.ExtractionResult;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public class NerNameLayer implements ExtractionLayer<String> {

    private final EntityRecognizer recognizer;
    private final Duration timeout;

    public NerNameLayer(EntityRecognizer recognizer, Duration timeout) {
        this.recognizer = recognizer;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "ner";
    }

    @Override
    public boolean isExternal() {
        return true;
    }

    @Override
    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }

    @Override
    public ExtractionResult<String> extract(String transcript) {
        List<String> persons = recognizer.findPersons(transcript);
        for (String person : persons) {
            Optional<String> name = NameTokens.normalize(person);
            if (name.isPresent()) {
                return ExtractionResult.success(name.get(), name());
            }
        }
        return ExtractionResult.failed("no_person_entity");
    }
}
