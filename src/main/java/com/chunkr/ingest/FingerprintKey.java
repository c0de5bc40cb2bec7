package com.chunkr.ingest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;

/**
 * Cache key for an embedding: SHA-256 of the normalized chunk text, independent of the chunk's id.
 */
public record FingerprintKey(String value) {

    public static FingerprintKey of(String text) {
        String normalized = normalize(text);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return new FingerprintKey(HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8))));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return Normalizer.normalize(text, Normalizer.Form.NFC).trim();
    }

    @Override
    public String toString() {
        return value.length() > 12 ? value.substring(0, 12) : value;
    }
}
