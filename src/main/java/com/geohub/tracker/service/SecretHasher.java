package com.geohub.tracker.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 of session secrets, as stored in {@code geodata.secret}.
 */
public final class SecretHasher {

    private SecretHasher() {
    }

    /**
     * @return lowercase hex digest, or null for a null/empty secret
     */
    public static String hash(String secret) {
        if (secret == null || secret.isEmpty()) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
