package com.ai.intake.client;

import java.util.Optional;

/**
 * Best-guess text completion used as the last extraction layer.
 */
public interface LlmClient {

    /**
     * @return the model's answer, or empty when the model is unavailable or the call failed
     */
    Optional<String> complete(String instruction, String transcript);
}
