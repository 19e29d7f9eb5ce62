package com.ai.intake.service;

import com.ai.intake.conversation.YesNoResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class YesNoClassifierTest {

    private final YesNoClassifier classifier = new YesNoClassifier();

    @ParameterizedTest
    @ValueSource(strings = {"yes", "Yeah.", "sure, go ahead", "that sounds good", "yes please book it"})
    void affirmative(String answer) {
        assertThat(classifier.classify(answer)).isEqualTo(YesNoResult.YES);
    }

    @ParameterizedTest
    @ValueSource(strings = {"no", "Nope!", "that's wrong", "can we do a different time"})
    void negative(String answer) {
        assertThat(classifier.classify(answer)).isEqualTo(YesNoResult.NO);
    }

    @Test
    void mixedOrEmptyIsUnknown() {
        assertThat(classifier.classify("yes, no wait")).isEqualTo(YesNoResult.UNKNOWN);
        assertThat(classifier.classify("what was the time again")).isEqualTo(YesNoResult.UNKNOWN);
        assertThat(classifier.classify("  ")).isEqualTo(YesNoResult.UNKNOWN);
        assertThat(classifier.classify(null)).isEqualTo(YesNoResult.UNKNOWN);
    }
}
