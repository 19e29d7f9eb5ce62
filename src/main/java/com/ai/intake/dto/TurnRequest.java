package com.ai.intake.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record TurnRequest(
        @NotBlank @Size(max = 64) @JsonProperty("call_id") String callId,
        @Size(max = 32) @JsonProperty("caller_number") String callerNumber,
        @Size(max = 2000) @JsonProperty("speech_text") String speechText) {
}
