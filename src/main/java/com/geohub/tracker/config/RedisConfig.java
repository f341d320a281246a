package com.geohub.tracker.config;

import com.geohub.tracker.live.ChannelKeyCodec;
import com.geohub.tracker.live.RedisChangePublisher;
import com.geohub.tracker.live.RedisChangeSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Redis pub/sub configuration for live updates.
 *
 * Active with {@code geohub.live.change-source=redis}. Useful when several
 * instances sit behind a load balancer: the instance that ingests a point and
 * the one holding the waiting request may differ, and Redis fans the change
 * event out to all of them.
 *
 * Channel names are the session tokens from {@link ChannelKeyCodec};
 * payloads repeat the token.
 *
 * Note: the connection factory and {@link StringRedisTemplate} come from
 * Spring Boot's RedisAutoConfiguration ({@code spring.data.redis.*}).
 */
@Configuration
@ConditionalOnProperty(name = "geohub.live.change-source", havingValue = "redis")
public class RedisConfig {

    /**
     * Listener container dedicated to live-update channels. Topics are added
     * and removed at runtime by {@link RedisChangeSource}.
     */
    @Bean
    public RedisMessageListenerContainer liveMessageListenerContainer(RedisConnectionFactory connectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        return container;
    }

    @Bean
    public RedisChangeSource redisChangeSource(RedisMessageListenerContainer liveMessageListenerContainer,
                                               ChannelKeyCodec codec) {
        return new RedisChangeSource(liveMessageListenerContainer, codec);
    }

    @Bean
    public RedisChangePublisher redisChangePublisher(StringRedisTemplate stringRedisTemplate, ChannelKeyCodec codec) {
        return new RedisChangePublisher(stringRedisTemplate, codec);
    }
}
