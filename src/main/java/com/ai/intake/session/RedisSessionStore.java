package com.ai.intake.session;

import com.ai.intake.config.IntakeProperties;
import com.ai.intake.conversation.ConversationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Sessions as Redis hashes {version, payload}. The version compare and the write happen in one Lua script,
 * so concurrent turns on the same call cannot interleave.
 */
public class RedisSessionStore extends AbstractSessionStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);

    private static final String FIELD_VERSION = "version";
    private static final String FIELD_PAYLOAD = "payload";

    private static final String WRITE_SCRIPT =
            "local cur = redis.call('HGET', KEYS[1], 'version')\n"
            + "if ARGV[4] == '1' and cur and tonumber(cur) ~= tonumber(ARGV[1]) then\n"
            + "  return -1\n"
            + "end\n"
            + "redis.call('HSET', KEYS[1], 'version', ARGV[2], 'payload', ARGV[3])\n"
            + "redis.call('EXPIRE', KEYS[1], ARGV[5])\n"
            + "return tonumber(ARGV[2])";

    private final StringRedisTemplate redisTemplate;
    private final SessionCodec codec;
    private final DefaultRedisScript<Long> writeScript;

    public RedisSessionStore(StringRedisTemplate redisTemplate, SessionCodec codec, Clock clock,
                             IntakeProperties.Session settings) {
        super(clock, settings);
        this.redisTemplate = redisTemplate;
        this.codec = codec;
        this.writeScript = new DefaultRedisScript<>(WRITE_SCRIPT, Long.class);
    }

    @Override
    public Optional<ConversationSession> find(String callId) {
        Object payload = redisTemplate.opsForHash().get(key(callId), FIELD_PAYLOAD);
        if (payload == null) return Optional.empty();
        return Optional.of(codec.decode(callId, payload.toString()));
    }

    @Override
    protected void write(ConversationSession session, long expectedVersion, Duration ttl, boolean conditional) {
        Long result = redisTemplate.execute(writeScript, List.of(key(session.getCallId())),
                String.valueOf(expectedVersion),
                String.valueOf(session.getVersion()),
                codec.encode(session),
                conditional ? "1" : "0",
                String.valueOf(Math.max(1, ttl.toSeconds())));
        if (result == null || result < 0) {
            log.info("Rejected stale session write callId={} expectedVersion={}", session.getCallId(), expectedVersion);
            throw new StaleSessionException(session.getCallId(), expectedVersion);
        }
    }

    @Override
    public void evict(String callId) {
        redisTemplate.delete(key(callId));
    }

    private String key(String callId) {
        return settings.getKeyPrefix() + callId;
    }
}
