package com.geohub.tracker.live;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Change source and publisher in one, backed by an in-JVM queue.
 *
 * Suitable for a single application instance (and for tests): ingestion and
 * live-wait requests must hit the same JVM. Mirrors NOTIFY semantics in that
 * a publish for a key nobody is subscribed to is dropped.
 */
@Slf4j
public class InProcessChangeSource implements ChangeSource, ChangePublisher {

    private final Set<ChannelKey> subscribed = ConcurrentHashMap.newKeySet();
    private final BlockingQueue<ChannelKey> events = new LinkedBlockingQueue<>();

    @Override
    public void subscribe(ChannelKey key) {
        subscribed.add(key);
    }

    @Override
    public void unsubscribe(ChannelKey key) {
        subscribed.remove(key);
    }

    @Override
    public void publish(ChannelKey key) {
        if (subscribed.contains(key)) {
            events.offer(key);
        } else {
            log.trace("No subscriber for {}, dropping change event", key);
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

    public boolean isSubscribed(ChannelKey key) {
        return subscribed.contains(key);
    }
}
