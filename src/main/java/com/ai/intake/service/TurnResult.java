package com.ai.intake.service;

import com.ai.intake.conversation.ConversationStep;

/**
 * What the caller hears next, whether the call should end, and the step the session is now at.
 */
public record TurnResult(String nextPrompt, boolean terminal, ConversationStep step) {
}
