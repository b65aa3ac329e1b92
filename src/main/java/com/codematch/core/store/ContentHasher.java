package com.codematch.core.store;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic SHA-256 content identity for files and metadata.
 */
public final class ContentHasher {

    private ContentHasher() {}

    public static String hashHex(byte[] content) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(content));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String hashHex(String text) {
        return hashHex(text.getBytes(StandardCharsets.UTF_8));
    }
}
