package com.ai.intake.extraction.phone;

import com.ai.intake.extraction.ExtractionLayer;
import com.ai.intake.extraction.ExtractionResult;

import java.util.regex.Pattern;

/**
 * Strips everything except digits and a leading '+', then accepts 7-11 digits or '+' with 8-15 digits.
 */
public class DigitPatternLayer implements ExtractionLayer<String> {

    private static final Pattern DIGIT_RUN = Pattern.compile("\\+\\d{8,15}|\\d{7,11}");

    private final PhoneNumbers phoneNumbers;

    public DigitPatternLayer(PhoneNumbers phoneNumbers) {
        this.phoneNumbers = phoneNumbers;
    }

    @Override
    public String name() {
        return "digit_pattern";
    }

    @Override
    public ExtractionResult<String> extract(String transcript) {
        String stripped = strip(transcript);
        if (!DIGIT_RUN.matcher(stripped).matches()) {
            return ExtractionResult.failed("no_digit_run");
        }
        return phoneNumbers.toE164(stripped)
                .map(e164 -> ExtractionResult.success(e164, name()))
                .orElseGet(() -> ExtractionResult.failed("not_possible_number"));
    }

    static String strip(String text) {
        String kept = text.replaceAll("[^0-9+]", "");
        boolean plus = kept.startsWith("+");
        String digits = kept.replace("+", "");
        return plus ? "+" + digits : digits;
    }
}
