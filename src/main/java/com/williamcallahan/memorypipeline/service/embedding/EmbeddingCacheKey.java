package com.williamcallahan.memorypipeline.service.embedding;

import com.williamcallahan.memorypipeline.support.ContentHasher;
import java.util.Objects;

/**
 * Content-addressed cache key. Derived only from the text and the generator, so the same text
 * embedded by the same provider and model hits regardless of which document produced it.
 * The text itself is never stored.
 *
 * @param provider provider identifier
 * @param model model identifier
 * @param dimensions vector size
 * @param normalized whether the provider returns unit vectors
 * @param textLength length of the normalized text
 * @param textHash SHA-256 of the normalized text, lowercase hex
 */
public record EmbeddingCacheKey(
        String provider, String model, int dimensions, boolean normalized, int textLength, String textHash) {

    private static final String SEPARATOR = "|";

    public EmbeddingCacheKey {
        requireNoSeparator(provider, "provider");
        requireNoSeparator(model, "model");
        Objects.requireNonNull(textHash, "textHash");
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be > 0");
        }
        if (textLength < 0) {
            throw new IllegalArgumentException("textLength must be >= 0");
        }
    }

    /**
     * Builds the key for a text after normalizing line endings.
     */
    public static EmbeddingCacheKey forText(
            String provider, String model, int dimensions, boolean normalized, String text, ContentHasher hasher) {
        String normalizedText = normalizeText(text);
        return new EmbeddingCacheKey(
                provider, model, dimensions, normalized, normalizedText.length(), hasher.sha256(normalizedText));
    }

    static String normalizeText(String text) {
        return text == null ? "" : text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Composite string used as the storage primary key.
     */
    public String toCompositeKey() {
        return String.join(SEPARATOR, provider, model, Integer.toString(dimensions), Boolean.toString(normalized),
                Integer.toString(textLength), textHash);
    }

    private static void requireNoSeparator(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isBlank() || value.contains(SEPARATOR)) {
            throw new IllegalArgumentException(field + " must be non-blank and must not contain '" + SEPARATOR + "'");
        }
    }
}
