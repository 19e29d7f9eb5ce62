package com.ai.intake.conversation;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-call dialogue state. The step moves only through {@link #advanceTo}; the sole backward move is
 * confirm to ask_time. Returning to ask_name happens only by replacing the session via a store reset.
 */
public class ConversationSession {

    public static final long DEFAULT_TTL_SECONDS = 900;

    private final String callId;
    private ConversationStep currentStep;
    private final SessionFields fields;
    private final Map<ConversationStep, Integer> retryCounts;
    private final Instant createdAt;
    private Instant updatedAt;
    private final long ttlSeconds;
    private long version;

    private ConversationSession(String callId, ConversationStep currentStep, SessionFields fields,
                                Map<ConversationStep, Integer> retryCounts, Instant createdAt,
                                Instant updatedAt, long ttlSeconds, long version) {
        if (callId == null || callId.isBlank()) {
            throw new IllegalArgumentException("callId is required");
        }
        this.callId = callId;
        this.currentStep = currentStep;
        this.fields = fields;
        this.retryCounts = new EnumMap<>(ConversationStep.class);
        this.retryCounts.putAll(retryCounts);
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.ttlSeconds = ttlSeconds;
        this.version = version;
    }

    /**
     * A fresh session at ask_name.
     */
    public static ConversationSession start(String callId, Instant now, long ttlSeconds) {
        return new ConversationSession(callId, ConversationStep.ASK_NAME, new SessionFields(),
                Collections.emptyMap(), now, now, ttlSeconds, 0);
    }

    /**
     * Rebuilds a session exactly as it was persisted. Only session stores call this.
     */
    public static ConversationSession restore(String callId, ConversationStep step, SessionFields fields,
                                              Map<ConversationStep, Integer> retryCounts, Instant createdAt,
                                              Instant updatedAt, long ttlSeconds, long version) {
        if (step == null || fields == null) {
            throw new IllegalArgumentException("step and fields are required");
        }
        return new ConversationSession(callId, step, fields,
                retryCounts == null ? Collections.emptyMap() : retryCounts,
                createdAt, updatedAt, ttlSeconds, version);
    }

    /**
     * Moves to {@code target}. Allowed: the immediate next step, or confirm back to ask_time.
     *
     * @throws InvalidTransitionException for anything else, or when the target's prerequisites are missing
     */
    public void advanceTo(ConversationStep target) {
        boolean forward = !currentStep.isTerminal() && currentStep.next() == target;
        boolean backToTime = currentStep == ConversationStep.CONFIRM && target == ConversationStep.ASK_TIME;
        if (!forward && !backToTime) {
            throw new InvalidTransitionException(currentStep, target, "out of sequence");
        }
        switch (target) {
            case ASK_MOBILE -> require(fields.getFullName() != null, target, "name not set");
            case ASK_TIME -> require(fields.hasNameAndPhone(), target, "name and phone must be set");
            case CONFIRM, COMPLETE -> require(fields.isComplete(), target, "fields incomplete");
            default -> {
            }
        }
        if (backToTime) {
            fields.setStartTimeUtc(null);
        }
        currentStep = target;
    }

    private void require(boolean condition, ConversationStep target, String reason) {
        if (!condition) {
            throw new InvalidTransitionException(currentStep, target, reason);
        }
    }

    /** Counts a failed attempt at the current step and returns the new count. */
    public int recordFailedAttempt() {
        return retryCounts.merge(currentStep, 1, Integer::sum);
    }

    public int retryCount(ConversationStep step) {
        return retryCounts.getOrDefault(step, 0);
    }

    /**
     * Stamps the version and time a store assigned on a successful write.
     */
    public void markPersisted(long newVersion, Instant at) {
        this.version = newVersion;
        this.updatedAt = at;
    }

    public String getCallId() {
        return callId;
    }

    public ConversationStep getCurrentStep() {
        return currentStep;
    }

    public SessionFields getFields() {
        return fields;
    }

    public Map<ConversationStep, Integer> getRetryCounts() {
        return Collections.unmodifiableMap(retryCounts);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public long getVersion() {
        return version;
    }

    public boolean isComplete() {
        return currentStep.isTerminal();
    }

    @Override
    public String toString() {
        return "ConversationSession{callId=" + callId + ", step=" + currentStep + ", version=" + version + "}";
    }
}
