package com.ai.intake.config;

import com.ai.intake.session.FallbackSessionStore;
import com.ai.intake.session.InMemorySessionStore;
import com.ai.intake.session.RedisSessionStore;
import com.ai.intake.session.SessionCodec;
import com.ai.intake.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * intake.session.backend=redis (default) gives Redis with in-process fallback; =memory gives the map alone.
 */
@Configuration
public class SessionStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionStoreConfig.class);

    @Bean
    public InMemorySessionStore inMemorySessionStore(SessionCodec codec, Clock clock, IntakeProperties properties) {
        return new InMemorySessionStore(codec, clock, properties.getSession());
    }

    @Bean
    @ConditionalOnProperty(name = "intake.session.backend", havingValue = "redis", matchIfMissing = true)
    public RedisSessionStore redisSessionStore(StringRedisTemplate redisTemplate, SessionCodec codec, Clock clock,
                                               IntakeProperties properties) {
        return new RedisSessionStore(redisTemplate, codec, clock, properties.getSession());
    }

    @Bean
    @Primary
    public SessionStore sessionStore(InMemorySessionStore memory, ObjectProvider<RedisSessionStore> redis) {
        RedisSessionStore primary = redis.getIfAvailable();
        if (primary == null) {
            log.info("Session backend: in-process map");
            return memory;
        }
        log.info("Session backend: Redis with in-process fallback");
        return new FallbackSessionStore(primary, memory);
    }
}
