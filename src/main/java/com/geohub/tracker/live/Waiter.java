package com.geohub.tracker.live;

import java.util.Objects;

/**
 * A blocked live-wait request: the session it waits on, where to send the
 * answer, and the cursor the client already had.
 *
 * Waiters compare by identity. Two requests for the same session are two
 * different waiters and each gets its own reply.
 */
public final class Waiter {

    private final ChannelKey key;
    private final ReplySink sink;
    private final Long lastSeen;

    public Waiter(ChannelKey key, ReplySink sink, Long lastSeen) {
        this.key = Objects.requireNonNull(key, "key");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.lastSeen = lastSeen;
    }

    public static Waiter forKey(ChannelKey key, Long lastSeen) {
        return new Waiter(key, new ReplySink(), lastSeen);
    }

    public ChannelKey key() {
        return key;
    }

    public ReplySink sink() {
        return sink;
    }

    public Long lastSeen() {
        return lastSeen;
    }

    @Override
    public String toString() {
        return "Waiter[" + key + ", lastSeen=" + lastSeen + "]";
    }
}
