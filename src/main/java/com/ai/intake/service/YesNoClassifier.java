package com.ai.intake.service;

import com.ai.intake.conversation.YesNoResult;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies the answer at the confirm step. Mixed signals ("yes, no wait") are UNKNOWN so the summary is re-read.
 */
@Service
public class YesNoClassifier {

    private static final Set<String> AFFIRMATIVE_EXACT = Set.of(
            "yes", "yeah", "yep", "ya", "yup", "uh huh", "uh-huh", "ok", "okay",
            "sure", "correct", "right", "absolutely", "definitely", "confirm", "book it"
    );

    private static final Set<String> NEGATIVE_EXACT = Set.of(
            "no", "nope", "nah", "wrong", "incorrect", "not quite", "no thanks", "no thank you"
    );

    private static final Pattern AFFIRMATIVE_PATTERN = Pattern.compile(
            "\\b(yes|yeah|yep|yup|ok|okay|sure|correct|right|confirm|absolutely|definitely|book it|go ahead|please do|sounds good|perfect)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern NEGATIVE_PATTERN = Pattern.compile(
            "\\b(no|nope|nah|wrong|incorrect|not right|change|different time|another time|wait)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public YesNoResult classify(String userInput) {
        if (userInput == null || userInput.isBlank()) {
            return YesNoResult.UNKNOWN;
        }
        String normalized = userInput.trim().toLowerCase(Locale.ROOT).replaceAll("[.!?,]+$", "");

        if (normalized.length() <= 15) {
            if (AFFIRMATIVE_EXACT.contains(normalized)) {
                return YesNoResult.YES;
            }
            if (NEGATIVE_EXACT.contains(normalized)) {
                return YesNoResult.NO;
            }
        }

        boolean yes = AFFIRMATIVE_PATTERN.matcher(normalized).find();
        boolean no = NEGATIVE_PATTERN.matcher(normalized).find();
        if (yes && no) {
            return YesNoResult.UNKNOWN;
        }
        if (yes) {
            return YesNoResult.YES;
        }
        if (no) {
            return YesNoResult.NO;
        }
        return YesNoResult.UNKNOWN;
    }
}
