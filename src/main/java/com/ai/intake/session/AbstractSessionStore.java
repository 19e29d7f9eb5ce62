package com.ai.intake.session;

import com.ai.intake.config.IntakeProperties;
import com.ai.intake.conversation.ConversationSession;
import com.ai.intake.conversation.ConversationStep;
import com.ai.intake.conversation.SessionFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;

/**
 * Shared get/save/reset logic. Backends only implement the raw versioned write.
 */
public abstract class AbstractSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(AbstractSessionStore.class);

    protected final Clock clock;
    protected final IntakeProperties.Session settings;

    protected AbstractSessionStore(Clock clock, IntakeProperties.Session settings) {
        this.clock = clock;
        this.settings = settings;
    }

    /**
     * Writes the encoded session under its call id with the given TTL.
     *
     * @param expectedVersion version the stored record must carry, checked only when {@code conditional}
     */
    protected abstract void write(ConversationSession session, long expectedVersion, Duration ttl, boolean conditional);

    @Override
    public ConversationSession get(String callId) {
        return find(callId).orElseGet(() -> ConversationSession.start(callId, clock.instant(), settings.getTtlSeconds()));
    }

    @Override
    public ConversationSession save(ConversationSession session) {
        return persist(session, true);
    }

    @Override
    public ConversationSession replace(ConversationSession session) {
        return persist(session, false);
    }

    @Override
    public ConversationSession reset(String callId, String reason) {
        long priorVersion;
        try {
            priorVersion = find(callId).map(ConversationSession::getVersion).orElse(0L);
        } catch (SessionCorruptedException e) {
            log.warn("Resetting unreadable session callId={}: {}", callId, e.getMessage());
            priorVersion = 0L;
        }
        Instant now = clock.instant();
        ConversationSession fresh = ConversationSession.restore(callId, ConversationStep.ASK_NAME, new SessionFields(),
                Collections.emptyMap(), now, now, settings.getTtlSeconds(), priorVersion);
        replace(fresh);
        log.info("AUDIT session reset callId={} reason={} priorVersion={}", callId, reason, priorVersion);
        return fresh;
    }

    private ConversationSession persist(ConversationSession session, boolean conditional) {
        long expected = session.getVersion();
        Instant previousUpdate = session.getUpdatedAt();
        session.markPersisted(expected + 1, clock.instant());
        try {
            write(session, expected, ttlFor(session), conditional);
        } catch (RuntimeException e) {
            session.markPersisted(expected, previousUpdate);
            throw e;
        }
        return session;
    }

    /** Completed sessions are kept only for the short retention window. */
    protected Duration ttlFor(ConversationSession session) {
        return session.isComplete()
                ? Duration.ofSeconds(settings.getCompletedRetentionSeconds())
                : Duration.ofSeconds(session.getTtlSeconds());
    }
}
