package com.williamcallahan.memorypipeline.domain.memory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A searchable memory record: one partition of a document with its embedding.
 *
 * @param id record id, stable across retries ({@code d=<document>//p=<partition>})
 * @param vector embedding, empty when embedding generation is disabled
 * @param tags filterable tags, including the reserved document and file tags
 * @param payload non-filterable payload such as the partition text
 */
public record MemoryRecord(String id, float[] vector, Map<String, String> tags, Map<String, Object> payload) {

    public static final String DOCUMENT_ID_TAG = "__document_id";
    public static final String FILE_ID_TAG = "__file_id";
    public static final String FILE_TYPE_TAG = "__file_type";
    public static final String FILE_PARTITION_TAG = "__file_part";

    public static final String TEXT_FIELD = "text";
    public static final String FILE_NAME_FIELD = "file";
    public static final String VECTOR_PROVIDER_FIELD = "vector_provider";
    public static final String VECTOR_GENERATOR_FIELD = "vector_generator";
    public static final String PAGE_NUMBER_FIELD = "page_number";
    public static final String LAST_UPDATE_FIELD = "last_update";

    public MemoryRecord {
        Objects.requireNonNull(id, "id");
        vector = vector == null ? new float[0] : vector;
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public String documentId() {
        return tags.getOrDefault(DOCUMENT_ID_TAG, "");
    }

    public String text() {
        Object text = payload.get(TEXT_FIELD);
        return text == null ? "" : text.toString();
    }
}
