package com.ai.intake.session;

import com.ai.intake.conversation.ConversationSession;

import java.util.Optional;

/**
 * Keyed, TTL-bound storage of per-call sessions. Writes for one call id are atomic; different call ids are
 * independent.
 */
public interface SessionStore {

    /** The stored session, if one exists and has not expired. */
    Optional<ConversationSession> find(String callId);

    /** The stored session, or a fresh unsaved session at ask_name. */
    ConversationSession get(String callId);

    /**
     * Persists the session and refreshes its TTL, provided the stored record still has the session's version.
     *
     * @throws StaleSessionException when a newer write happened in between
     */
    ConversationSession save(ConversationSession session);

    /** Persists the session regardless of the stored version. */
    ConversationSession replace(ConversationSession session);

    /** Replaces the session with a fresh one at ask_name. Audit-logged. */
    ConversationSession reset(String callId, String reason);

    void evict(String callId);
}
