package com.ai.intake.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Error body. Fatal turn errors also carry the prompt the caller should hear and {@code terminal=true}.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String code;
    private String message;
    private OffsetDateTime timestamp;
    private Map<String, Object> details;

    @JsonProperty("next_prompt")
    private String nextPrompt;

    private Boolean terminal;
}
