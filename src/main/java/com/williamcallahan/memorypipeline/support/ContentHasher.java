package com.williamcallahan.memorypipeline.support;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprints for uploaded files, generated artifacts and embedding cache keys.
 */
@Component
public class ContentHasher {
    private static final int SHORT_HASH_LENGTH = 12;
    private static final HexFormat HEX = HexFormat.of();

    public String sha256(String text) {
        return sha256(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return lowercase hex digest of {@code content}
     */
    public String sha256(byte[] content) {
        try {
            return HEX.formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /** Prefix of the digest, for names that must stay short. */
    public String shortSha256(String text) {
        return sha256(text).substring(0, SHORT_HASH_LENGTH);
    }
}
