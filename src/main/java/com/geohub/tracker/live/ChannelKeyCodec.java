package com.geohub.tracker.live;

/**
 * Bidirectional mapping between a {@link ChannelKey} and a wire-safe token.
 *
 * Token grammar: {@code <prefix>_<client>_<secret>}, where the secret part may
 * be empty. The separator is not part of the alphanumeric alphabet, so the
 * split is unambiguous and {@code decode(encode(k))} always equals {@code k}.
 *
 * The token ends up inside LISTEN/UNLISTEN statements and Redis channel names,
 * so both directions apply a strict allow-list instead of trusting callers:
 * <ul>
 *   <li>client: non-empty, ASCII letters and digits only</li>
 *   <li>secret: ASCII letters and digits only, may be empty</li>
 *   <li>whole token: at most {@value #MAX_TOKEN_LENGTH} characters (PostgreSQL
 *       silently truncates longer identifiers, which would merge channels)</li>
 * </ul>
 */
public final class ChannelKeyCodec {

    public static final String DEFAULT_PREFIX = "geohub";
    public static final int MAX_TOKEN_LENGTH = 63;
    public static final int MAX_PREFIX_LENGTH = 6;

    private static final char SEPARATOR = '_';

    private final String prefix;

    public ChannelKeyCodec() {
        this(DEFAULT_PREFIX);
    }

    public ChannelKeyCodec(String prefix) {
        if (prefix == null || prefix.isEmpty() || prefix.length() > MAX_PREFIX_LENGTH
                || !isAsciiAlphanumeric(prefix)) {
            throw new IllegalArgumentException(
                "Channel prefix must be 1-" + MAX_PREFIX_LENGTH + " ASCII alphanumeric characters: " + prefix);
        }
        this.prefix = prefix;
    }

    public String encode(ChannelKey key) {
        return encode(key.client(), key.secret());
    }

    public String encode(String client, String secret) {
        String s = secret == null ? "" : secret;
        if (client == null || client.isEmpty() || !isAsciiAlphanumeric(client)) {
            throw new IllegalArgumentException("Client must be a non-empty ASCII alphanumeric string");
        }
        if (!isAsciiAlphanumeric(s)) {
            throw new IllegalArgumentException("Secret must be an ASCII alphanumeric string");
        }
        String token = prefix + SEPARATOR + client + SEPARATOR + s;
        if (token.length() > MAX_TOKEN_LENGTH) {
            throw new IllegalArgumentException(
                "Channel token exceeds " + MAX_TOKEN_LENGTH + " characters for client " + client);
        }
        return token;
    }

    public ChannelKey decode(String token) {
        if (token == null || token.length() > MAX_TOKEN_LENGTH) {
            throw new IllegalArgumentException("Not a channel token: " + token);
        }
        String head = prefix + SEPARATOR;
        if (!token.startsWith(head)) {
            throw new IllegalArgumentException("Channel token has a foreign prefix: " + token);
        }
        String rest = token.substring(head.length());
        int split = rest.indexOf(SEPARATOR);
        if (split <= 0 || rest.indexOf(SEPARATOR, split + 1) >= 0) {
            throw new IllegalArgumentException("Malformed channel token: " + token);
        }
        String client = rest.substring(0, split);
        String secret = rest.substring(split + 1);
        if (!isAsciiAlphanumeric(client) || !isAsciiAlphanumeric(secret)) {
            throw new IllegalArgumentException("Malformed channel token: " + token);
        }
        return new ChannelKey(client, secret);
    }

    static boolean isAsciiAlphanumeric(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean ok = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (!ok) {
                return false;
            }
        }
        return true;
    }
}
