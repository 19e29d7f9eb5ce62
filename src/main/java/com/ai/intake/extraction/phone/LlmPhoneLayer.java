package com.ai.intake.extraction.phone;

import com.ai.intake.client.LlmClient;
import com.ai.intake.extraction.ExtractionLayer;
import com.ai.intake.extraction.ExtractionResult;

import java.util.Optional;

/**
 * Asks the LLM for a best guess. The guess only counts if the region validator accepts it.
 */
public class LlmPhoneLayer implements ExtractionLayer<String> {

    static final String INSTRUCTION = "The caller was asked for their mobile number. From the transcript, "
            + "reply with the phone number as digits only (with a leading + if a country code was said). "
            + "Reply NONE if there is no phone number.";

    private final LlmClient llm;
    private final RegionValidationLayer validator;

    public LlmPhoneLayer(LlmClient llm, RegionValidationLayer validator) {
        this.llm = llm;
        this.validator = validator;
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
    public ExtractionResult<String> extract(String transcript) {
        Optional<String> guess = llm.complete(INSTRUCTION, transcript);
        if (guess.isEmpty() || guess.get().isBlank() || guess.get().trim().equalsIgnoreCase("NONE")) {
            return ExtractionResult.failed("llm_no_guess");
        }
        ExtractionResult<String> validated = validator.extract(guess.get());
        return validated.isSuccess()
                ? ExtractionResult.success(validated.getValue(), name())
                : ExtractionResult.failed("llm_guess_invalid");
    }
}
