package com.geohub.tracker.live;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Publishes change events on the Redis channel named after the session token.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisChangePublisher implements ChangePublisher {

    private final StringRedisTemplate redisTemplate;
    private final ChannelKeyCodec codec;

    @Override
    public void publish(ChannelKey key) {
        String token = codec.encode(key);
        try {
            Long receivers = redisTemplate.convertAndSend(token, token);
            log.debug("Published {} to {} subscriber(s)", key, receivers);
        } catch (RuntimeException e) {
            throw new ChangeSourceException("Redis publish failed for " + key, e);
        }
    }
}
