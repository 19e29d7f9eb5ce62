package com.ai.intake.conversation;

/**
 * Raised when a session would leave the fixed step sequence. Fatal for the turn.
 */
public class InvalidTransitionException extends IllegalStateException {

    private final ConversationStep from;
    private final ConversationStep to;

    public InvalidTransitionException(ConversationStep from, ConversationStep to, String reason) {
        super("Invalid transition " + from + " -> " + to + ": " + reason);
        this.from = from;
        this.to = to;
    }

    public ConversationStep getFrom() {
        return from;
    }

    public ConversationStep getTo() {
        return to;
    }
}
