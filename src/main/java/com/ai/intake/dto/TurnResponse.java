package com.ai.intake.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TurnResponse(
        @JsonProperty("next_prompt") String nextPrompt,
        @JsonProperty("terminal") boolean terminal) {
}
