package com.ai.intake.session;

/**
 * A stored session record could not be decoded. Fatal for the turn.
 */
public class SessionCorruptedException extends RuntimeException {

    public SessionCorruptedException(String callId, Throwable cause) {
        super("Session record for call " + callId + " is unreadable", cause);
    }
}
