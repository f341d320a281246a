package com.geohub.tracker.service;

import com.geohub.tracker.live.ChannelKey;

/**
 * Validation of client names and secrets arriving over HTTP.
 *
 * Both end up in pub/sub channel names, so this is a security boundary and
 * not just input hygiene:
 * - client: 1..{@value #MAX_CLIENT_LENGTH} ASCII letters or digits
 * - secret: 0..{@value #MAX_SECRET_LENGTH} ASCII letters or digits; empty means "no secret"
 *
 * The length limits keep every encoded channel token within PostgreSQL's
 * 63-character identifier limit.
 */
public final class ClientIdentifiers {

    public static final int MAX_CLIENT_LENGTH = 30;
    public static final int MAX_SECRET_LENGTH = 24;

    private ClientIdentifiers() {
    }

    public static boolean acceptable(String client, String secret) {
        if (client == null || client.isEmpty() || client.length() > MAX_CLIENT_LENGTH || !isAsciiAlphanumeric(client)) {
            return false;
        }
        return secret == null || (secret.length() <= MAX_SECRET_LENGTH && isAsciiAlphanumeric(secret));
    }

    /**
     * Validates and normalises a (client, secret) pair into a session key.
     *
     * @throws InvalidIdentifierException if either part is unacceptable
     */
    public static ChannelKey require(String client, String secret) {
        if (!acceptable(client, secret)) {
            throw new InvalidIdentifierException(
                "You have supplied an invalid secret or client name. Both must be ASCII alphanumeric strings "
                    + "(client up to " + MAX_CLIENT_LENGTH + ", secret up to " + MAX_SECRET_LENGTH + " characters).");
        }
        return ChannelKey.of(client, normaliseSecret(secret));
    }

    /**
     * An empty secret is the same as no secret.
     */
    public static String normaliseSecret(String secret) {
        return secret == null || secret.isEmpty() ? null : secret;
    }

    private static boolean isAsciiAlphanumeric(String value) {
        return value.chars().allMatch(c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'));
    }
}
