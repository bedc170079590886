package de.icepolcka.catalog.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Utility for generating stable, fixed-width digests of identity keys.
 * Identity keys can be long; the digest is what the store indexes.
 */
public final class IdentityDigest {

    private IdentityDigest() {
        // Utility class
    }

    /**
     * SHA-256 of the canonical identity string, hex encoded.
     */
    public static String of(String canonicalIdentity) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonicalIdentity.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
