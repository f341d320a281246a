package com.geohub.tracker.live;

import java.util.Objects;

/**
 * Identifies one live-update session: a client name plus an optional secret.
 *
 * The key is used both as the registry key inside the dispatcher and, once
 * encoded by {@link ChannelKeyCodec}, as the pub/sub channel name.
 *
 * An absent secret is normalised to the empty string, so {@code (alice, null)}
 * and {@code (alice, "")} are the same session.
 *
 * @param client client name (ASCII alphanumeric, non-empty)
 * @param secret session secret (ASCII alphanumeric, may be empty)
 */
public record ChannelKey(String client, String secret) {

    public ChannelKey {
        Objects.requireNonNull(client, "client");
        secret = secret == null ? "" : secret;
    }

    public static ChannelKey of(String client, String secret) {
        return new ChannelKey(client, secret);
    }

    public boolean hasSecret() {
        return !secret.isEmpty();
    }

    /**
     * Secret as callers outside the live package see it: {@code null} when absent.
     */
    public String secretOrNull() {
        return hasSecret() ? secret : null;
    }

    /**
     * Log-safe representation; never prints the secret itself.
     */
    @Override
    public String toString() {
        return "ChannelKey[client=" + client + ", secret=" + (hasSecret() ? "***" : "<none>") + "]";
    }
}
