package com.ai.intake.extraction.name;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Token cleanup shared by all name layers: disfluency removal, stop words, title case.
 */
public final class NameTokens {

    /** Fillers and discourse words dropped wherever they appear. */
    static final Set<String> DISFLUENCIES = Set.of(
            "um", "umm", "uh", "uhh", "uhm", "er", "erm", "ah", "ahh", "eh", "hmm", "mm", "mhm",
            "like", "well", "so", "okay", "ok", "oh", "yeah", "yes", "yep", "no", "nope",
            "hi", "hello", "hey", "actually", "basically", "sorry", "sure", "please", "thanks");

    /** Words that end the name span ("John Smith calling about..."). */
    static final Set<String> STOP_WORDS = Set.of(
            "name", "name's", "and", "calling", "here", "speaking", "from", "my", "number", "is", "i", "i'm",
            "for", "about", "to", "with", "the", "a", "an", "at", "on", "phone", "appointment", "it's");

    /** Scheduling words that show up in answers but are never names. Months that double as names are left out. */
    static final Set<String> TIME_WORDS = Set.of(
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday",
            "january", "february", "september", "october", "november", "december",
            "morning", "afternoon", "evening", "tonight", "noon", "today", "tomorrow", "tomorow",
            "week", "next", "book", "booking");

    private NameTokens() {
    }

    /**
     * Cleans a candidate span and returns "First Last" (or a single given name) in title case.
     */
    public static Optional<String> normalize(String span) {
        List<String> tokens = clean(span);
        if (tokens.isEmpty()) return Optional.empty();
        List<String> pair = tokens.subList(0, Math.min(2, tokens.size()));
        String name = String.join(" ", pair.stream().map(NameTokens::titleCase).toList());
        return isDenied(name) ? Optional.empty() : Optional.of(name);
    }

    /**
     * Splits on whitespace and punctuation, drops disfluencies and partial words, and stops at the first stop word.
     */
    static List<String> clean(String span) {
        List<String> out = new ArrayList<>();
        if (span == null) return out;
        for (String raw : span.trim().split("[\\s,;:!?.]+")) {
            String token = raw.toLowerCase(Locale.ROOT).replaceAll("^[^\\p{L}]+|[^\\p{L}'\\-]+$", "");
            if (token.isEmpty() || raw.endsWith("-") || !token.matches("[\\p{L}][\\p{L}'\\-]*")) {
                continue;
            }
            if (DISFLUENCIES.contains(token)) continue;
            if (STOP_WORDS.contains(token)) break;
            if (token.length() < 2) continue;
            out.add(token);
        }
        return out;
    }

    /** True when the whole value is empty or consists only of filler, stop words or partial tokens. */
    public static boolean isDenied(String value) {
        if (StringUtils.isBlank(value)) return true;
        for (String token : value.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (token.endsWith("-") || !token.matches("[\\p{L}][\\p{L}'\\-]*")) return true;
            if (DISFLUENCIES.contains(token) || STOP_WORDS.contains(token) || TIME_WORDS.contains(token)) return true;
        }
        return false;
    }

    static String titleCase(String token) {
        StringBuilder sb = new StringBuilder(token.length());
        boolean upperNext = true;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            sb.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = c == '-' || (c == '\'' && i == 1);
        }
        return sb.toString();
    }
}
