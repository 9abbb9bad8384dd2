package com.williamcallahan.memorypipeline.domain.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An uploaded file and the artifacts handlers generated from it.
 *
 * @param name stored file name
 * @param mimeType detected or declared content type
 * @param sizeBytes upload size
 * @param contentSha256 SHA-256 of the uploaded bytes
 * @param generatedFiles generated file name to descriptor, in creation order
 */
public record FileRecord(
        String name,
        String mimeType,
        long sizeBytes,
        String contentSha256,
        Map<String, GeneratedFileDescriptor> generatedFiles) {

    public FileRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(mimeType, "mimeType");
        contentSha256 = contentSha256 == null ? "" : contentSha256;
        generatedFiles = generatedFiles == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(generatedFiles));
    }

    public static FileRecord uploaded(String name, String mimeType, long sizeBytes, String contentSha256) {
        return new FileRecord(name, mimeType, sizeBytes, contentSha256, Map.of());
    }

    /**
     * Returns a copy with the descriptor added, or replacing the one with the same name.
     */
    public FileRecord withGeneratedFile(GeneratedFileDescriptor descriptor) {
        Map<String, GeneratedFileDescriptor> updated = new LinkedHashMap<>(generatedFiles);
        updated.put(descriptor.name(), descriptor);
        return new FileRecord(name, mimeType, sizeBytes, contentSha256, updated);
    }

    public boolean hasGeneratedFile(String generatedName) {
        return generatedFiles.containsKey(generatedName);
    }

    public List<GeneratedFileDescriptor> generatedFilesOfType(ArtifactType type) {
        return generatedFiles.values().stream()
                .filter(descriptor -> descriptor.type() == type)
                .toList();
    }
}
