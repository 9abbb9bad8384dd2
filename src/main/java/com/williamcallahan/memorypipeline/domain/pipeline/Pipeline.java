package com.williamcallahan.memorypipeline.domain.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracked processing state for one ingested document.
 *
 * <p>Instances are immutable; every transition returns a copy. The constructor enforces
 * {@code plannedSteps == completedSteps ++ remainingSteps}, so no observable pipeline can hold a step
 * that is both completed and remaining.
 *
 * @param id document id, also the pipeline id
 * @param ownerScope index the document's memory records are written to
 * @param executionId id of this run; a re-upload of the same document starts a new execution
 * @param createdAt when the execution was scheduled
 * @param lastUpdatedAt last persisted transition
 * @param plannedSteps ordered step names
 * @param completedSteps steps that finished, in order
 * @param remainingSteps steps still to run, in order
 * @param files uploaded files with their generated artifacts
 * @param tags user tags copied onto every memory record
 * @param previousExecutionRecordIds memory record ids written by a superseded execution, purged on save
 * @param failureReason reason the pipeline was poisoned, or null while it is healthy
 */
public record Pipeline(
        String id,
        String ownerScope,
        String executionId,
        Instant createdAt,
        Instant lastUpdatedAt,
        List<String> plannedSteps,
        List<String> completedSteps,
        List<String> remainingSteps,
        List<FileRecord> files,
        Map<String, String> tags,
        List<String> previousExecutionRecordIds,
        String failureReason) {

    public Pipeline {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ownerScope, "ownerScope");
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(lastUpdatedAt, "lastUpdatedAt");
        plannedSteps = List.copyOf(Objects.requireNonNull(plannedSteps, "plannedSteps"));
        completedSteps = List.copyOf(Objects.requireNonNull(completedSteps, "completedSteps"));
        remainingSteps = List.copyOf(Objects.requireNonNull(remainingSteps, "remainingSteps"));
        files = files == null ? List.of() : List.copyOf(files);
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        previousExecutionRecordIds = previousExecutionRecordIds == null ? List.of() : List.copyOf(previousExecutionRecordIds);

        List<String> observed = new ArrayList<>(completedSteps);
        observed.addAll(remainingSteps);
        if (!observed.equals(plannedSteps)) {
            throw new IllegalArgumentException("Pipeline " + id + " steps out of sync: planned=" + plannedSteps
                    + " completed=" + completedSteps + " remaining=" + remainingSteps);
        }
    }

    /**
     * Starts a new execution with every planned step remaining.
     */
    public static Pipeline create(
            String id,
            String ownerScope,
            String executionId,
            List<String> steps,
            List<FileRecord> files,
            Map<String, String> tags,
            Instant now) {
        return new Pipeline(id, ownerScope, executionId, now, now, steps, List.of(), steps, files, tags,
                List.of(), null);
    }

    @JsonIgnore
    public boolean isComplete() {
        return remainingSteps.isEmpty();
    }

    /**
     * Ready for search once every step ran and there was at least one file to process.
     */
    @JsonIgnore
    public boolean isDocumentReady() {
        return isComplete() && !files.isEmpty();
    }

    @JsonIgnore
    public Optional<String> currentStep() {
        return remainingSteps.isEmpty() ? Optional.empty() : Optional.of(remainingSteps.get(0));
    }

    /**
     * Moves the first remaining step to the end of the completed steps.
     *
     * @param executedStep step the caller just ran; must be the current step
     * @param now transition timestamp
     * @return advanced copy
     * @throws IllegalStateException if {@code executedStep} is not the current step
     */
    public Pipeline moveToNextStep(String executedStep, Instant now) {
        String current = currentStep()
                .orElseThrow(() -> new IllegalStateException("Pipeline " + id + " has no remaining steps"));
        if (!current.equals(executedStep)) {
            throw new IllegalStateException(
                    "Pipeline " + id + " expected step " + current + " but " + executedStep + " was executed");
        }
        List<String> completed = new ArrayList<>(completedSteps);
        completed.add(current);
        return new Pipeline(id, ownerScope, executionId, createdAt, now, plannedSteps, completed,
                remainingSteps.subList(1, remainingSteps.size()), files, tags, previousExecutionRecordIds,
                failureReason);
    }

    public Pipeline withFiles(List<FileRecord> updatedFiles) {
        return new Pipeline(id, ownerScope, executionId, createdAt, lastUpdatedAt, plannedSteps, completedSteps,
                remainingSteps, updatedFiles, tags, previousExecutionRecordIds, failureReason);
    }

    /**
     * Replaces the file with the same name.
     */
    public Pipeline withFile(FileRecord file) {
        List<FileRecord> updated = new ArrayList<>(files.size());
        boolean replaced = false;
        for (FileRecord existing : files) {
            if (existing.name().equals(file.name())) {
                updated.add(file);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            updated.add(file);
        }
        return withFiles(updated);
    }

    public Pipeline withPreviousExecutionRecordIds(List<String> recordIds) {
        return new Pipeline(id, ownerScope, executionId, createdAt, lastUpdatedAt, plannedSteps, completedSteps,
                remainingSteps, files, tags, recordIds, failureReason);
    }

    public Pipeline withFailure(String reason, Instant now) {
        return new Pipeline(id, ownerScope, executionId, createdAt, now, plannedSteps, completedSteps,
                remainingSteps, files, tags, previousExecutionRecordIds, reason);
    }

    public Pipeline touch(Instant now) {
        return new Pipeline(id, ownerScope, executionId, createdAt, now, plannedSteps, completedSteps,
                remainingSteps, files, tags, previousExecutionRecordIds, failureReason);
    }

    /**
     * Id of the memory record created for a partition of this document.
     */
    public String recordId(String partitionFileName) {
        return "d=" + id + "//p=" + partitionFileName;
    }

    /**
     * Record ids this execution writes (or has written) on save, one per partition.
     */
    @JsonIgnore
    public List<String> recordIds() {
        List<String> ids = new ArrayList<>();
        for (FileRecord file : files) {
            for (GeneratedFileDescriptor descriptor : file.generatedFilesOfType(ArtifactType.TEXT_PARTITION)) {
                ids.add(recordId(descriptor.name()));
            }
        }
        return ids;
    }
}
