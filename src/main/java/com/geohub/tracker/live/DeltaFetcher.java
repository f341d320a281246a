package com.geohub.tracker.live;

/**
 * Looks up rows newer than a cursor for one session.
 */
@FunctionalInterface
public interface DeltaFetcher {

    /**
     * Returns at most {@code limit} rows with id greater than {@code cursor},
     * newest first, together with the highest id seen. Callers must not assume
     * a single row even when {@code limit} is 1 elsewhere: batched ingestion may
     * have inserted several.
     *
     * @param key    session to look up
     * @param cursor last id the caller has seen; null means "from the beginning"
     * @param limit  maximum number of rows
     * @return the delta, or {@link Delta#absent()} when there are no such rows
     * @throws RuntimeException when the lookup itself fails
     */
    Delta fetch(ChannelKey key, Long cursor, int limit);
}
