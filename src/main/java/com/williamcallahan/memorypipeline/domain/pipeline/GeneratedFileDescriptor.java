package com.williamcallahan.memorypipeline.domain.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Describes a file produced by a handler from one uploaded file.
 *
 * <p>Generated files are append-only. A handler records its step name in {@code processedBy}
 * once it has consumed the file, so a retried step can skip work that already happened.
 *
 * @param name generated file name, unique within the document
 * @param parentName name of the uploaded file this was derived from
 * @param type artifact kind
 * @param mimeType content type of the generated file
 * @param partition true for partition files that feed embedding generation
 * @param sizeBytes size of the generated file
 * @param partitionNumber zero-based partition ordinal, or 0 for non-partition files
 * @param sectionNumber page or section the content came from, 1-based
 * @param sourcePartitionName for embedding files, the partition they were computed from; empty otherwise
 * @param contentSha256 SHA-256 of the generated content
 * @param processedBy step names that already consumed this file
 */
public record GeneratedFileDescriptor(
        String name,
        String parentName,
        ArtifactType type,
        String mimeType,
        boolean partition,
        long sizeBytes,
        int partitionNumber,
        int sectionNumber,
        String sourcePartitionName,
        String contentSha256,
        List<String> processedBy) {

    public GeneratedFileDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(parentName, "parentName");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(mimeType, "mimeType");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0");
        }
        sourcePartitionName = sourcePartitionName == null ? "" : sourcePartitionName;
        contentSha256 = contentSha256 == null ? "" : contentSha256;
        processedBy = processedBy == null ? List.of() : List.copyOf(processedBy);
    }

    /**
     * Creates a descriptor for a freshly written artifact that no step has consumed yet.
     */
    public static GeneratedFileDescriptor of(
            String name,
            String parentName,
            ArtifactType type,
            String mimeType,
            long sizeBytes,
            String contentSha256) {
        return new GeneratedFileDescriptor(
                name, parentName, type, mimeType, type == ArtifactType.TEXT_PARTITION, sizeBytes, 0, 1, "",
                contentSha256, List.of());
    }

    public GeneratedFileDescriptor withPartitionPosition(int partitionNumber, int sectionNumber) {
        return new GeneratedFileDescriptor(name, parentName, type, mimeType, partition, sizeBytes,
                partitionNumber, sectionNumber, sourcePartitionName, contentSha256, processedBy);
    }

    public GeneratedFileDescriptor withSourcePartition(String sourcePartition) {
        return new GeneratedFileDescriptor(name, parentName, type, mimeType, partition, sizeBytes,
                partitionNumber, sectionNumber, sourcePartition, contentSha256, processedBy);
    }

    public boolean alreadyProcessedBy(String stepName) {
        return processedBy.contains(stepName);
    }

    public GeneratedFileDescriptor markProcessedBy(String stepName) {
        if (alreadyProcessedBy(stepName)) {
            return this;
        }
        List<String> steps = new ArrayList<>(processedBy);
        steps.add(stepName);
        return new GeneratedFileDescriptor(name, parentName, type, mimeType, partition, sizeBytes,
                partitionNumber, sectionNumber, sourcePartitionName, contentSha256, steps);
    }
}
