package com.geohub.tracker.service;

/**
 * A client name or secret failed validation. Mapped to HTTP 400.
 */
public class InvalidIdentifierException extends RuntimeException {

    public InvalidIdentifierException(String message) {
        super(message);
    }
}
