package com.ai.intake.session;

import com.ai.intake.config.IntakeProperties;
import com.ai.intake.conversation.ConversationSession;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process session map. Used as the degraded-mode fallback for Redis, or alone with
 * {@code intake.session.backend=memory}. Entries hold the encoded record so callers never share instances.
 */
public class InMemorySessionStore extends AbstractSessionStore {

    private static final int PURGE_THRESHOLD = 1000;

    private final SessionCodec codec;
    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();

    public InMemorySessionStore(SessionCodec codec, Clock clock, IntakeProperties.Session settings) {
        super(clock, settings);
        this.codec = codec;
    }

    @Override
    public Optional<ConversationSession> find(String callId) {
        Entry entry = sessions.get(callId);
        if (entry == null) return Optional.empty();
        if (entry.isExpired(clock.instant())) {
            sessions.remove(callId, entry);
            return Optional.empty();
        }
        return Optional.of(codec.decode(callId, entry.payload()));
    }

    @Override
    protected void write(ConversationSession session, long expectedVersion, Duration ttl, boolean conditional) {
        Instant now = clock.instant();
        String payload = codec.encode(session);
        sessions.compute(session.getCallId(), (id, existing) -> {
            Entry live = existing != null && !existing.isExpired(now) ? existing : null;
            if (conditional && live != null && live.version() != expectedVersion) {
                throw new StaleSessionException(id, expectedVersion);
            }
            return new Entry(payload, session.getVersion(), now.plus(ttl));
        });
        if (sessions.size() > PURGE_THRESHOLD) {
            purgeExpired();
        }
    }

    @Override
    public void evict(String callId) {
        sessions.remove(callId);
    }

    public boolean contains(String callId) {
        Entry entry = sessions.get(callId);
        return entry != null && !entry.isExpired(clock.instant());
    }

    public void purgeExpired() {
        Instant now = clock.instant();
        sessions.values().removeIf(e -> e.isExpired(now));
    }

    private record Entry(String payload, long version, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
