package com.williamcallahan.memorypipeline.domain.content;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Source-of-truth record for ingested content.
 *
 * <p>{@code ready} flips to true only after the terminal step of the document's pipeline succeeded.
 */
public record ContentRecord(
        String id,
        String index,
        String content,
        String mimeType,
        long byteSize,
        boolean ready,
        Map<String, String> tags,
        Map<String, String> metadata,
        Instant createdAt,
        Instant updatedAt) {

    public ContentRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(mimeType, "mimeType");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        content = content == null ? "" : content;
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Content record for a freshly scheduled document that has not been extracted yet.
     */
    public static ContentRecord pending(
            String id, String index, String mimeType, long byteSize, Map<String, String> tags, Instant now) {
        return new ContentRecord(id, index, "", mimeType, byteSize, false, tags, Map.of(), now, now);
    }
}
