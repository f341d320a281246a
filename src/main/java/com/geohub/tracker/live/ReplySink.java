package com.geohub.tracker.live;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-shot handoff from the dispatcher thread to the waiting request thread.
 *
 * Lifecycle:
 * <pre>
 *   OPEN --send()--&gt; REPLIED
 *   OPEN --abandon()--&gt; ABANDONED
 * </pre>
 * Only the first transition wins. A {@code send} after the consumer gave up is
 * a no-op that returns false, so the dispatcher never blocks or fails on a
 * sink nobody reads.
 */
public final class ReplySink {

    private final CompletableFuture<Delta> reply = new CompletableFuture<>();

    /**
     * Delivers the reply.
     *
     * @return true if this call delivered it; false if a reply was already
     *         delivered or the consumer abandoned the sink
     */
    public boolean send(Delta delta) {
        return reply.complete(delta == null ? Delta.absent() : delta);
    }

    /**
     * Marks the sink as no longer read. Pending and future sends are dropped.
     *
     * @return true if the sink was still open
     */
    public boolean abandon() {
        return reply.cancel(false);
    }

    public boolean isAbandoned() {
        return reply.isCancelled();
    }

    public boolean isDone() {
        return reply.isDone();
    }

    /**
     * Blocks until a reply arrives or {@code timeout} passes. On timeout the
     * sink is abandoned; if a reply won the race against that, it is returned.
     *
     * @return the reply, or empty on timeout
     */
    public Optional<Delta> await(Duration timeout) throws InterruptedException {
        try {
            return Optional.of(reply.get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            if (abandon()) {
                return Optional.empty();
            }
            return completedReply();
        } catch (InterruptedException e) {
            abandon();
            throw e;
        } catch (CancellationException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            // send() never completes exceptionally
            throw new IllegalStateException("Reply sink failed", e.getCause());
        }
    }

    private Optional<Delta> completedReply() {
        if (reply.isCancelled()) {
            return Optional.empty();
        }
        return Optional.of(reply.join());
    }
}
