package com.geohub.tracker.live;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Change source over Redis pub/sub, for deployments where several
 * application instances share one Redis.
 *
 * Subscriptions are managed through Spring Data Redis'
 * {@link RedisMessageListenerContainer}: one listener instance, one
 * {@link ChannelTopic} per subscribed key. Messages arrive on the container's
 * threads and are handed to the dispatcher through a blocking queue.
 */
@Slf4j
public class RedisChangeSource implements ChangeSource, MessageListener {

    private final RedisMessageListenerContainer container;
    private final ChannelKeyCodec codec;
    private final BlockingQueue<ChannelKey> events = new LinkedBlockingQueue<>();

    public RedisChangeSource(RedisMessageListenerContainer container, ChannelKeyCodec codec) {
        this.container = container;
        this.codec = codec;
    }

    @Override
    public void subscribe(ChannelKey key) {
        ChannelTopic topic = new ChannelTopic(codec.encode(key));
        try {
            container.addMessageListener(this, topic);
        } catch (RuntimeException e) {
            throw new ChangeSourceException("Redis subscribe failed for " + key, e);
        }
    }

    @Override
    public void unsubscribe(ChannelKey key) {
        ChannelTopic topic = new ChannelTopic(codec.encode(key));
        try {
            container.removeMessageListener(this, topic);
        } catch (RuntimeException e) {
            throw new ChangeSourceException("Redis unsubscribe failed for " + key, e);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String token = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            events.offer(codec.decode(token));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring Redis message with undecodable payload on channel {}",
                new String(message.getChannel(), StandardCharsets.UTF_8));
        }
    }

    @Override
    public Optional<ChannelKey> next(Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            return Optional.ofNullable(events.poll());
        }
        try {
            return Optional.ofNullable(events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
}
