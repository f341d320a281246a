package com.geohub.tracker.live;

/**
 * Failure of a subscribe, unsubscribe, poll or publish operation.
 *
 * The dispatcher treats these as transient: it logs them and keeps running.
 */
public class ChangeSourceException extends RuntimeException {

    public ChangeSourceException(String message) {
        super(message);
    }

    public ChangeSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
