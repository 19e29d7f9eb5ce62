package com.ai.intake.session;

import com.ai.intake.conversation.ConversationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.util.Optional;

/**
 * Redis first, in-process map when Redis is unavailable. A session written to the map while degraded
 * takes precedence until it has been written back to Redis.
 */
public class FallbackSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(FallbackSessionStore.class);

    private final SessionStore primary;
    private final InMemorySessionStore fallback;

    public FallbackSessionStore(SessionStore primary, InMemorySessionStore fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public Optional<ConversationSession> find(String callId) {
        Optional<ConversationSession> degraded = fallback.find(callId);
        Optional<ConversationSession> stored;
        try {
            stored = primary.find(callId);
        } catch (DataAccessException e) {
            logDegraded("find", callId, e);
            return degraded;
        }
        if (degraded.isPresent()
                && (stored.isEmpty() || degraded.get().getVersion() > stored.get().getVersion())) {
            return degraded;
        }
        return stored;
    }

    @Override
    public ConversationSession get(String callId) {
        return find(callId).orElseGet(() -> fallback.get(callId));
    }

    @Override
    public ConversationSession save(ConversationSession session) {
        String callId = session.getCallId();
        try {
            Optional<ConversationSession> degraded = fallback.find(callId);
            if (degraded.isPresent()) {
                if (degraded.get().getVersion() != session.getVersion()) {
                    throw new StaleSessionException(callId, session.getVersion());
                }
                primary.replace(session);
                fallback.evict(callId);
                log.info("Session written back to primary store callId={} version={}", callId, session.getVersion());
                return session;
            }
            return primary.save(session);
        } catch (DataAccessException e) {
            logDegraded("save", callId, e);
            return fallback.save(session);
        }
    }

    @Override
    public ConversationSession replace(ConversationSession session) {
        try {
            primary.replace(session);
            fallback.evict(session.getCallId());
            return session;
        } catch (DataAccessException e) {
            logDegraded("replace", session.getCallId(), e);
            return fallback.replace(session);
        }
    }

    @Override
    public ConversationSession reset(String callId, String reason) {
        try {
            ConversationSession fresh = primary.reset(callId, reason);
            fallback.evict(callId);
            return fresh;
        } catch (DataAccessException e) {
            logDegraded("reset", callId, e);
            return fallback.reset(callId, reason);
        }
    }

    @Override
    public void evict(String callId) {
        fallback.evict(callId);
        try {
            primary.evict(callId);
        } catch (DataAccessException e) {
            logDegraded("evict", callId, e);
        }
    }

    private void logDegraded(String operation, String callId, DataAccessException e) {
        log.warn("StoreDegraded: primary session store failed on {} callId={}, using in-process store: {}",
                operation, callId, e.getMessage());
    }
}
