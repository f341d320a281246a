package com.geohub.tracker.live;

/**
 * Announces that new rows exist for a session. Called by the ingestion path
 * after the insert has been committed.
 */
public interface ChangePublisher {

    /**
     * @throws ChangeSourceException if the announcement could not be sent
     */
    void publish(ChannelKey key);
}
