package com.ai.intake.extraction.name;

import com.ai.intake.extraction.ExtractionLayer;
import com.ai.intake.extraction.ExtractionResult;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Introductions ("my name is", "this is", "I'm", "call me"...) optionally after a greeting,
 * or a bare two-word answer.
 */
public class PatternNameLayer implements ExtractionLayer<String> {

    private static final List<Pattern> INTRODUCTIONS = List.of(
            intro("my name is"),
            intro("my name's"),
            intro("name is"),
            intro("you can call me"),
            intro("call me"),
            intro("this is"),
            intro("i am"),
            intro("i'm"),
            intro("it's"),
            intro("it is"));

    private static Pattern intro(String phrase) {
        return Pattern.compile("\\b" + Pattern.quote(phrase) + "[\\s,]+([^.!?]+)", Pattern.CASE_INSENSITIVE);
    }

    @Override
    public String name() {
        return "pattern";
    }

    @Override
    public ExtractionResult<String> extract(String transcript) {
        String text = transcript.replace('’', '\'');
        for (Pattern p : INTRODUCTIONS) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                Optional<String> name = NameTokens.normalize(m.group(1));
                if (name.isPresent()) {
                    return ExtractionResult.success(name.get(), name());
                }
            }
        }

        List<String> tokens = NameTokens.clean(text);
        if (tokens.size() == 2) {
            return NameTokens.normalize(String.join(" ", tokens))
                    .map(n -> ExtractionResult.success(n, name()))
                    .orElseGet(() -> ExtractionResult.failed("denied"));
        }
        return ExtractionResult.failed("no_pattern");
    }
}
