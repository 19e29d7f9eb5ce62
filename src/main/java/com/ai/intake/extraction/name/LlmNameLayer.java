package com.ai.intake.extraction.name;

import com.ai.intake.client.LlmClient;
import com.ai.intake.extraction.ExtractionLayer;
import com.ai.intake.extraction.ExtractionResult;

import java.util.Optional;

public class LlmNameLayer implements ExtractionLayer<String> {

    static final String INSTRUCTION = "The caller was asked for their full name. From the transcript, "
            + "reply with only the person's first and last name. Ignore filler words and greetings. "
            + "Reply NONE if no name was given.";

    private final LlmClient llm;

    public LlmNameLayer(LlmClient llm) {
        this.llm = llm;
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
        if (guess.isEmpty() || guess.get().trim().equalsIgnoreCase("NONE")) {
            return ExtractionResult.failed("llm_no_guess");
        }
        return NameTokens.normalize(guess.get())
                .map(n -> ExtractionResult.success(n, name()))
                .orElseGet(() -> ExtractionResult.failed("llm_guess_denied"));
    }
}
