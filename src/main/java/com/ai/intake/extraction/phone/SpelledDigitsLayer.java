package com.ai.intake.extraction.phone;

import com.ai.intake.extraction.ExtractionLayer;
import com.ai.intake.extraction.ExtractionResult;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns spoken digits ("eight one five", "oh", "double five") into numerals and retries the digit pattern.
 */
public class SpelledDigitsLayer implements ExtractionLayer<String> {

    private static final Map<String, String> WORD_DIGITS = Map.ofEntries(
            Map.entry("zero", "0"),
            Map.entry("one", "1"), Map.entry("two", "2"), Map.entry("three", "3"),
            Map.entry("four", "4"), Map.entry("five", "5"), Map.entry("six", "6"),
            Map.entry("seven", "7"), Map.entry("eight", "8"), Map.entry("nine", "9"));

    private static final Pattern REPEAT = Pattern.compile("\\b(double|triple)\\s+([a-z]+|\\d)\\b");
    private static final Pattern WORD = Pattern.compile("\\b[a-z]+\\b");
    private static final Pattern OH = Pattern.compile("\\b(?:oh|o)\\b(?!')(?: +(?:oh|o)\\b(?!'))*");

    private final DigitPatternLayer digitPattern;

    public SpelledDigitsLayer(DigitPatternLayer digitPattern) {
        this.digitPattern = digitPattern;
    }

    @Override
    public String name() {
        return "spelled_digits";
    }

    @Override
    public ExtractionResult<String> extract(String transcript) {
        String converted = toNumerals(transcript);
        if (converted.equals(transcript.toLowerCase(Locale.ROOT))) {
            return ExtractionResult.failed("no_spelled_digits");
        }
        ExtractionResult<String> result = digitPattern.extract(converted);
        return result.isSuccess() ? ExtractionResult.success(result.getValue(), name()) : result;
    }

    static String toNumerals(String transcript) {
        String text = transcript.toLowerCase(Locale.ROOT).replace('-', ' ');

        Matcher repeat = REPEAT.matcher(text);
        StringBuilder expanded = new StringBuilder();
        while (repeat.find()) {
            int times = repeat.group(1).equals("double") ? 2 : 3;
            String digit = repeat.group(2);
            repeat.appendReplacement(expanded, Matcher.quoteReplacement((digit + " ").repeat(times).trim()));
        }
        repeat.appendTail(expanded);

        Matcher word = WORD.matcher(expanded.toString());
        StringBuilder out = new StringBuilder();
        while (word.find()) {
            String digit = WORD_DIGITS.get(word.group());
            word.appendReplacement(out, digit != null ? digit : Matcher.quoteReplacement(word.group()));
        }
        word.appendTail(out);
        return ohToZero(out.toString());
    }

    /** A run of "oh" is zeros only beside another digit; "Oh, it's ..." stays a word. */
    private static String ohToZero(String text) {
        Matcher oh = OH.matcher(text);
        StringBuilder out = new StringBuilder();
        while (oh.find()) {
            boolean digitBefore = Character.isDigit(neighbour(text, oh.start() - 1, -1));
            boolean digitAfter = Character.isDigit(neighbour(text, oh.end(), 1));
            String run = digitBefore || digitAfter ? oh.group().replaceAll("oh|o", "0") : oh.group();
            oh.appendReplacement(out, run);
        }
        oh.appendTail(out);
        return out.toString();
    }

    private static char neighbour(String text, int from, int step) {
        for (int i = from; i >= 0 && i < text.length(); i += step) {
            char c = text.charAt(i);
            if (c != ' ') return c;
        }
        return ' ';
    }
}
