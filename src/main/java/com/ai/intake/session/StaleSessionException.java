package com.ai.intake.session;

/**
 * A save carried an older version than the stored record. The caller should reload and re-prompt.
 */
public class StaleSessionException extends RuntimeException {

    private final String callId;
    private final long expectedVersion;

    public StaleSessionException(String callId, long expectedVersion) {
        super("Stale write for call " + callId + " at version " + expectedVersion);
        this.callId = callId;
        this.expectedVersion = expectedVersion;
    }

    public String getCallId() {
        return callId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
