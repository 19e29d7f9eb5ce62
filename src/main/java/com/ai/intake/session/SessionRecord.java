package com.ai.intake.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted JSON shape of a session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionRecord(
        @JsonProperty("call_id") String callId,
        @JsonProperty("current_step") String currentStep,
        @JsonProperty("fields") Fields fields,
        @JsonProperty("retry_counts") Map<String, Integer> retryCounts,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("ttl_seconds") long ttlSeconds,
        @JsonProperty("version") long version) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Fields(
            @JsonProperty("full_name") String fullName,
            @JsonProperty("phone") String phone,
            @JsonProperty("start_time_utc") Instant startTimeUtc,
            @JsonProperty("duration_minutes") Integer durationMinutes) {
    }
}
