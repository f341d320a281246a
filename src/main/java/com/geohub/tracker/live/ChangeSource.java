package com.geohub.tracker.live;

import java.time.Duration;
import java.util.Optional;

/**
 * Adapter over a publish/subscribe primitive (PostgreSQL LISTEN/NOTIFY, Redis
 * pub/sub or an in-JVM queue).
 *
 * Implementations are driven by exactly one thread, the {@link LiveDispatcher},
 * and need not be thread-safe for these three calls. Publishing happens
 * elsewhere, through {@link ChangePublisher}.
 */
public interface ChangeSource {

    /**
     * Starts receiving change events for {@code key}. Subscribing twice is harmless.
     *
     * @throws ChangeSourceException if the underlying command fails
     */
    void subscribe(ChannelKey key);

    /**
     * Stops receiving change events for {@code key}. Events already in flight
     * may still be returned by {@link #next(Duration)}.
     *
     * @throws ChangeSourceException if the underlying command fails
     */
    void unsubscribe(ChannelKey key);

    /**
     * Returns the next change event, waiting at most {@code timeout}.
     * {@link Duration#ZERO} checks without blocking.
     *
     * @return the key whose data changed, or empty when the wait timed out
     * @throws ChangeSourceException if the underlying connection fails
     */
    Optional<ChannelKey> next(Duration timeout);
}
