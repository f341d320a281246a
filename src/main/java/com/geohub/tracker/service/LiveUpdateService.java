package com.geohub.tracker.service;

import com.geohub.tracker.dto.LiveUpdateRecord;
import com.geohub.tracker.live.ChannelKey;
import com.geohub.tracker.live.Delta;
import com.geohub.tracker.live.LiveDispatcher;
import com.geohub.tracker.live.Waiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Request-side half of the live long-poll.
 *
 * Flow:
 * 1. Create a {@link Waiter} with a fresh reply sink
 * 2. Hand it to the {@link LiveDispatcher} (a single queue offer)
 * 3. Block on the sink for the requested timeout
 * 4. On timeout, abandon the sink and ask the dispatcher to drop the waiter
 *
 * A timeout is not an error: the client gets a "no new rows" result that
 * carries its cursor unchanged, and simply asks again.
 */
@Service
@Slf4j
public class LiveUpdateService {

    static final String NO_NEW_ROWS = "No new rows";

    private final LiveDispatcher dispatcher;
    private final int defaultTimeoutSeconds;
    private final int maxTimeoutSeconds;

    public LiveUpdateService(
        LiveDispatcher dispatcher,
        @Value("${geohub.live.default-timeout-seconds:30}") int defaultTimeoutSeconds,
        @Value("${geohub.live.max-timeout-seconds:300}") int maxTimeoutSeconds
    ) {
        this.dispatcher = dispatcher;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
        this.maxTimeoutSeconds = Math.max(maxTimeoutSeconds, 1);
    }

    /**
     * Waits for the next point of a session.
     *
     * @param key            validated session key
     * @param timeoutSeconds how long to wait; null means the default (30s),
     *                       values above the configured maximum are clamped
     * @param last           cursor the client already has; echoed back on timeout
     */
    public LiveUpdateRecord waitForUpdate(ChannelKey key, Integer timeoutSeconds, Long last) {
        Duration timeout = effectiveTimeout(timeoutSeconds);
        Waiter waiter = Waiter.forKey(key, last);
        dispatcher.register(waiter);

        Optional<Delta> reply;
        try {
            reply = waiter.sink().await(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.cancel(waiter);
            log.debug("Live wait for {} interrupted", key);
            return LiveUpdateRecord.noUpdate(key.client(), last, NO_NEW_ROWS);
        }

        if (reply.isEmpty()) {
            dispatcher.cancel(waiter);
            log.debug("Live wait for {} timed out after {}s", key, timeout.toSeconds());
            return LiveUpdateRecord.noUpdate(key.client(), last, NO_NEW_ROWS);
        }

        Delta delta = reply.get();
        if (!delta.isPresent()) {
            return LiveUpdateRecord.noUpdate(key.client(), last, NO_NEW_ROWS);
        }
        return LiveUpdateRecord.update(key.client(), delta.last(), delta.geo());
    }

    Duration effectiveTimeout(Integer timeoutSeconds) {
        int seconds = timeoutSeconds == null ? defaultTimeoutSeconds : timeoutSeconds;
        seconds = Math.max(0, Math.min(seconds, maxTimeoutSeconds));
        return Duration.ofSeconds(seconds);
    }

    public LiveDispatcher.Stats stats() {
        return dispatcher.stats();
    }
}
