package com.ai.intake.session;

import com.ai.intake.conversation.ConversationSession;
import com.ai.intake.conversation.ConversationStep;
import com.ai.intake.conversation.SessionFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON encoding of sessions for the Redis backend.
 */
@Component
public class SessionCodec {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public String encode(ConversationSession session) {
        SessionFields f = session.getFields();
        Map<String, Integer> retries = new LinkedHashMap<>();
        session.getRetryCounts().forEach((step, count) -> retries.put(step.wireName(), count));
        SessionRecord record = new SessionRecord(
                session.getCallId(),
                session.getCurrentStep().wireName(),
                new SessionRecord.Fields(f.getFullName(), f.getPhone(), f.getStartTimeUtc(), f.getDurationMinutes()),
                retries,
                session.getCreatedAt(),
                session.getUpdatedAt(),
                session.getTtlSeconds(),
                session.getVersion());
        try {
            return mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode session " + session.getCallId(), e);
        }
    }

    /**
     * @throws SessionCorruptedException when the payload is not a readable session record
     */
    public ConversationSession decode(String callId, String json) {
        try {
            SessionRecord record = mapper.readValue(json, SessionRecord.class);
            if (record.callId() == null || record.currentStep() == null) {
                throw new IllegalArgumentException("missing call_id or current_step");
            }
            SessionFields fields = new SessionFields();
            if (record.fields() != null) {
                fields.setFullName(record.fields().fullName());
                fields.setPhone(record.fields().phone());
                fields.setStartTimeUtc(record.fields().startTimeUtc());
                if (record.fields().durationMinutes() != null) {
                    fields.setDurationMinutes(record.fields().durationMinutes());
                }
            }
            Map<ConversationStep, Integer> retries = new EnumMap<>(ConversationStep.class);
            if (record.retryCounts() != null) {
                record.retryCounts().forEach((step, count) -> retries.put(ConversationStep.fromWireName(step), count));
            }
            return ConversationSession.restore(record.callId(), ConversationStep.fromWireName(record.currentStep()),
                    fields, retries, record.createdAt(), record.updatedAt(), record.ttlSeconds(), record.version());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SessionCorruptedException(callId, e);
        }
    }
}
