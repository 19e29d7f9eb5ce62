package com.ai.intake.dto;

import com.ai.intake.conversation.ConversationSession;
import com.ai.intake.utils.PhoneMask;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator view of a session. The phone number is masked.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionView(
        @JsonProperty("call_id") String callId,
        @JsonProperty("current_step") String currentStep,
        @JsonProperty("full_name") String fullName,
        @JsonProperty("phone") String phone,
        @JsonProperty("start_time_utc") Instant startTimeUtc,
        @JsonProperty("duration_minutes") int durationMinutes,
        @JsonProperty("retry_counts") Map<String, Integer> retryCounts,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("version") long version) {

    public static SessionView of(ConversationSession session) {
        Map<String, Integer> retries = new LinkedHashMap<>();
        session.getRetryCounts().forEach((step, count) -> retries.put(step.wireName(), count));
        String phone = session.getFields().getPhone();
        return new SessionView(
                session.getCallId(),
                session.getCurrentStep().wireName(),
                session.getFields().getFullName(),
                phone == null ? null : PhoneMask.mask(phone),
                session.getFields().getStartTimeUtc(),
                session.getFields().getDurationMinutes(),
                retries,
                session.getCreatedAt(),
                session.getUpdatedAt(),
                session.getVersion());
    }
}
