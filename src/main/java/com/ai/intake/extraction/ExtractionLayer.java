package com.ai.intake.extraction;

import java.time.Duration;
import java.util.Optional;

/**
 * One strategy in an extraction chain. Implementations return {@link ExtractionResult#failed} instead of
 * throwing; the pipeline still guards against layers that do throw.
 */
public interface ExtractionLayer<T> {

    String name();

    ExtractionResult<T> extract(String transcript);

    /** External layers run on the bounded executor under a timeout. */
    default boolean isExternal() {
        return false;
    }

    /** Overrides the pipeline's default per-layer budget. */
    default Optional<Duration> timeout() {
        return Optional.empty();
    }
}
