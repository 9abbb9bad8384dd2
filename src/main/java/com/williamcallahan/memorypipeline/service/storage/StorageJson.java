package com.williamcallahan.memorypipeline.service.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * JSON codec for the columns that hold structured state.
 */
@Component
public class StorageJson {
    public static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    public static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public StorageJson(ObjectMapper objectMapper) {
        this.mapper = objectMapper
                .copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException exception) {
            throw new StorageOperationException("Failed to serialize " + value.getClass().getSimpleName(), exception);
        }
    }

    public <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException exception) {
            throw new StorageOperationException("Failed to deserialize " + type.getSimpleName(), exception);
        }
    }

    public <T> T read(String json, TypeReference<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException exception) {
            throw new StorageOperationException("Failed to deserialize stored JSON", exception);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
