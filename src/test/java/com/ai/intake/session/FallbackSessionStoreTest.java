package com.ai.intake.session;

import com.ai.intake.config.IntakeProperties;
import com.ai.intake.conversation.ConversationSession;
import com.ai.intake.conversation.ConversationStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FallbackSessionStoreTest {

    private SessionStore primary;
    private InMemorySessionStore memory;
    private FallbackSessionStore store;

    @BeforeEach
    void setUp() {
        primary = Mockito.mock(SessionStore.class);
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T15:00:00Z"), ZoneOffset.UTC);
        memory = new InMemorySessionStore(new SessionCodec(), clock, new IntakeProperties.Session());
        store = new FallbackSessionStore(primary, memory);
    }

    @Test
    void healthyPrimaryIsUsed() {
        ConversationSession session = memory.get("CA1");
        when(primary.save(any())).thenAnswer(inv -> inv.getArgument(0));

        store.save(session);

        verify(primary).save(session);
        assertThat(memory.contains("CA1")).isFalse();
    }

    @Test
    void unavailablePrimaryDegradesToMemory() {
        when(primary.find(anyString())).thenThrow(new RedisConnectionFailureException("down"));
        when(primary.save(any())).thenThrow(new RedisConnectionFailureException("down"));

        ConversationSession session = store.get("CA1");
        session.getFields().setFullName("Johnny Walker");
        session.advanceTo(ConversationStep.ASK_MOBILE);
        store.save(session);

        assertThat(memory.contains("CA1")).isTrue();
        ConversationSession next = store.get("CA1");
        assertThat(next.getCurrentStep()).isEqualTo(ConversationStep.ASK_MOBILE);
        assertThat(next.getVersion()).isEqualTo(1);
    }

    @Test
    void degradedCopyWinsOverOlderPrimaryCopy() {
        ConversationSession older = memory.get("CA1");
        older.markPersisted(1, Instant.parse("2026-10-19T15:00:00Z"));
        when(primary.find("CA1")).thenReturn(Optional.of(older));

        ConversationSession degraded = memory.get("CA1");
        degraded.getFields().setFullName("Johnny Walker");
        degraded.advanceTo(ConversationStep.ASK_MOBILE);
        memory.save(degraded);
        memory.save(memory.get("CA1"));

        assertThat(store.find("CA1")).get()
                .extracting(ConversationSession::getCurrentStep)
                .isEqualTo(ConversationStep.ASK_MOBILE);
    }

    @Test
    void recoveredPrimaryReceivesWriteBack() {
        ConversationSession degraded = memory.get("CA1");
        memory.save(degraded);
        when(primary.find("CA1")).thenReturn(Optional.empty());
        doAnswer(inv -> inv.getArgument(0)).when(primary).replace(any());

        ConversationSession session = store.get("CA1");
        session.getFields().setFullName("Johnny Walker");
        session.advanceTo(ConversationStep.ASK_MOBILE);
        store.save(session);

        verify(primary).replace(session);
        verify(primary, never()).save(any());
        assertThat(memory.contains("CA1")).isFalse();
    }

    @Test
    void resetFallsBackWhenPrimaryIsDown() {
        when(primary.reset(anyString(), anyString())).thenThrow(new RedisConnectionFailureException("down"));

        ConversationSession fresh = store.reset("CA1", "operator request");

        assertThat(fresh.getCurrentStep()).isEqualTo(ConversationStep.ASK_NAME);
        assertThat(memory.contains("CA1")).isTrue();
    }
}
