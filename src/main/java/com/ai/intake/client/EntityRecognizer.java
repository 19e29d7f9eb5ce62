package com.ai.intake.client;

import java.util.List;

/**
 * Named-entity recognition over a transcript.
 */
public interface EntityRecognizer {

    boolean isEnabled();

    /** Person names in order of appearance. */
    List<String> findPersons(String text);
}
