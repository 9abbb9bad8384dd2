package com.williamcallahan.memorypipeline.service.pipeline;

import com.williamcallahan.memorypipeline.domain.content.ContentRecord;
import com.williamcallahan.memorypipeline.domain.pipeline.FileRecord;
import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;
import com.williamcallahan.memorypipeline.domain.pipeline.PipelineStatus;
import com.williamcallahan.memorypipeline.domain.queue.Operation;
import com.williamcallahan.memorypipeline.service.pipeline.handlers.HandlerResult;
import com.williamcallahan.memorypipeline.service.pipeline.handlers.PipelineSteps;
import com.williamcallahan.memorypipeline.service.pipeline.handlers.StepHandler;
import com.williamcallahan.memorypipeline.service.queue.LockContentionAnomaly;
import com.williamcallahan.memorypipeline.service.queue.OperationQueue;
import com.williamcallahan.memorypipeline.service.queue.QueueOptions;
import com.williamcallahan.memorypipeline.service.storage.ContentStore;
import com.williamcallahan.memorypipeline.service.storage.DocumentStorage;
import com.williamcallahan.memorypipeline.service.storage.PipelineStore;
import com.williamcallahan.memorypipeline.service.storage.StorageOperationException;
import com.williamcallahan.memorypipeline.support.ContentHasher;
import com.williamcallahan.memorypipeline.support.FailureClassifier;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the per-document pipeline state machine.
 *
 * <p>Scheduling persists the pipeline and enqueues an operation for its first step. Workers hand each
 * claimed operation to {@link #process(Operation)}, which runs the step's handler and applies the
 * outcome: success moves the step to the completed list and enqueues the next step, transient failures
 * are retried with capped exponential backoff until the retry budget is exhausted, and permanent failures
 * go straight to the poison queue. The next step is only enqueued after the previous operation is
 * complete, so the steps of one document never run concurrently.
 */
@Service
public class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    static final String DELETE_INDEX_PIPELINE_PREFIX = "delete-index-";

    private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9._=-]{1,200}$");
    private static final String RESERVED_TAG_PREFIX = "__";

    private final PipelineStore pipelineStore;
    private final ContentStore contentStore;
    private final OperationQueue queue;
    private final HandlerRegistry registry;
    private final DocumentStorage storage;
    private final QueueOptions options;
    private final ContentHasher hasher;
    private final Clock clock;

    public PipelineOrchestrator(
            PipelineStore pipelineStore,
            ContentStore contentStore,
            OperationQueue queue,
            HandlerRegistry registry,
            DocumentStorage storage,
            QueueOptions options,
            ContentHasher hasher,
            Clock clock) {
        this.pipelineStore = Objects.requireNonNull(pipelineStore, "pipelineStore");
        this.contentStore = Objects.requireNonNull(contentStore, "contentStore");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.options = Objects.requireNonNull(options, "options");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Stores the upload and schedules its pipeline.
     *
     * <p>Uploading a document id that already exists supersedes the previous execution: its outstanding
     * operations are cancelled and the records it saved are purged by the new execution's save step.
     *
     * @return document id, generated when the upload has none
     * @throws InvalidPipelineException if the steps, ids, files or tags are invalid
     */
    public String schedule(DocumentUpload upload) {
        Objects.requireNonNull(upload, "upload");
        registry.validate(upload.steps());
        String index = requireValidId(upload.index(), "index");
        String documentId = upload.documentId() == null || upload.documentId().isBlank()
                ? newId()
                : requireValidId(upload.documentId(), "document id");
        validateFiles(upload);
        validateTags(upload.tags());

        Instant now = clock.instant();
        List<String> supersededRecordIds = supersede(documentId, index);

        List<FileRecord> files = new ArrayList<>(upload.files().size());
        long totalBytes = 0;
        for (UploadedFile file : upload.files()) {
            byte[] content = file.content();
            try {
                storage.writeFile(index, documentId, file.name(), content);
            } catch (IOException ioException) {
                throw new StorageOperationException("Failed to store upload " + file.name(), ioException);
            }
            files.add(FileRecord.uploaded(file.name(), file.mimeType(), content.length, hasher.sha256(content)));
            totalBytes += content.length;
        }

        Pipeline pipeline = Pipeline.create(documentId, index, newId(), upload.steps(), files, upload.tags(), now)
                .withPreviousExecutionRecordIds(supersededRecordIds);
        contentStore.upsert(ContentRecord.pending(
                documentId, index, files.get(0).mimeType(), totalBytes, upload.tags(), now));
        start(pipeline);
        return documentId;
    }

    /**
     * Schedules removal of a document's records, files and content.
     *
     * @return id of the deletion pipeline, which is the document id
     */
    public String deleteDocument(String index, String documentId) {
        String validIndex = requireValidId(index, "index");
        String validDocumentId = requireValidId(documentId, "document id");
        supersede(validDocumentId, validIndex);
        List<String> steps = List.of(PipelineSteps.DELETE_DOCUMENT);
        registry.validate(steps);
        start(Pipeline.create(validDocumentId, validIndex, newId(), steps, List.of(), Map.of(), clock.instant()));
        return validDocumentId;
    }

    /**
     * Cancels every pipeline of the index and schedules removal of the whole index.
     *
     * @return id of the deletion pipeline
     */
    public String deleteIndex(String index) {
        String validIndex = requireValidId(index, "index");
        for (Pipeline pipeline : pipelineStore.findByScope(validIndex)) {
            queue.cancelAll(pipeline.id());
        }
        List<String> steps = List.of(PipelineSteps.DELETE_INDEX);
        registry.validate(steps);
        String pipelineId = DELETE_INDEX_PIPELINE_PREFIX + validIndex;
        start(Pipeline.create(pipelineId, validIndex, newId(), steps, List.of(), Map.of(), clock.instant()));
        return pipelineId;
    }

    /**
     * Cancels the outstanding operations of a pipeline. A step already running is allowed to finish,
     * but no further step is enqueued.
     *
     * @return number of operations cancelled
     */
    public int cancel(String pipelineId) {
        int cancelled = queue.cancelAll(pipelineId);
        PIPELINE_LOG.info("[PIPELINE] Cancelled pipeline {} ({} operation(s))", pipelineId, cancelled);
        return cancelled;
    }

    public boolean isReady(String documentId) {
        return contentStore.isReady(documentId);
    }

    public Optional<PipelineStatus> status(String documentId) {
        return pipelineStore.find(documentId).map(this::toStatus);
    }

    /**
     * Runs the step of a claimed operation and applies the outcome. Called by workers.
     */
    public void process(Operation operation) {
        try {
            runClaimed(operation);
        } catch (LockContentionAnomaly anomaly) {
            String reason = "Lock contention: " + anomaly.getMessage();
            log.error("[PIPELINE] {} - forcing operation {} to poison", reason, operation.id());
            queue.forcePoison(operation.id(), reason);
            recordFailure(operation, reason);
        }
    }

    /**
     * Applies a handler outcome to a claimed operation.
     */
    public void advance(Operation operation, HandlerResult result) {
        if (result instanceof HandlerResult.Success success) {
            onSuccess(operation, success.pipeline());
        } else if (result instanceof HandlerResult.TransientFailure failure) {
            onTransientFailure(operation, failure.pipeline(), failure.reason());
        } else if (result instanceof HandlerResult.PermanentFailure failure) {
            poison(operation, failure.pipeline(), failure.reason());
        }
    }

    /**
     * Re-enqueues the current step of every unfinished, healthy pipeline, and marks ready the documents
     * whose pipeline finished without the readiness flag being written. Enqueueing is idempotent,
     * so pipelines whose operation is still queued are unaffected.
     *
     * @return number of operations that had to be re-created
     */
    public int resumeStalledPipelines() {
        for (String documentId : contentStore.findNotReadyIds()) {
            pipelineStore.find(documentId)
                    .filter(pipeline -> pipeline.isDocumentReady() && pipeline.failureReason() == null)
                    .ifPresent(pipeline -> contentStore.markReady(pipeline.id()));
        }
        int resumed = 0;
        for (Pipeline pipeline : pipelineStore.findIncomplete()) {
            if (pipeline.failureReason() != null) {
                continue;
            }
            if (queue.enqueue(Operation.forCurrentStep(pipeline, options.queueName(), clock.instant()))) {
                resumed++;
                PIPELINE_LOG.info("[PIPELINE] Resumed pipeline {} at step {}",
                        pipeline.id(), pipeline.currentStep().orElse("?"));
            }
        }
        return resumed;
    }

    private void runClaimed(Operation operation) {
        Optional<Pipeline> stored = pipelineStore.find(operation.contentId());
        if (stored.isEmpty() || !stored.get().executionId().equals(operation.executionId())) {
            log.info("[PIPELINE] Retiring operation {}: execution {} was superseded",
                    operation.id(), operation.executionId());
            queue.complete(operation);
            return;
        }
        if (queue.isCancelled(operation.id())) {
            log.info("[PIPELINE] Operation {} was cancelled before it started", operation.id());
            queue.release(operation);
            return;
        }

        Pipeline pipeline = stored.get();
        if (pipeline.completedSteps().size() > operation.completedSteps().size()) {
            // An earlier attempt advanced the pipeline but did not get to settle the operation.
            if (pipeline.isDocumentReady()) {
                contentStore.markReady(pipeline.id());
            }
            if (completeStep(operation)) {
                enqueueNext(operation, pipeline);
            }
            return;
        }
        String step = operation.currentStep();
        if (!pipeline.currentStep().map(step::equals).orElse(false)) {
            poison(operation, pipeline, "Operation step '" + step + "' does not match pipeline step '"
                    + pipeline.currentStep().orElse("") + "'");
            return;
        }

        Optional<StepHandler> handler = registry.find(step);
        if (handler.isEmpty()) {
            poison(operation, pipeline, "No handler registered for step '" + step + "'");
            return;
        }

        HandlerResult result;
        try {
            log.debug("[PIPELINE] Running step {} of {} (operation {})", step, pipeline.id(), operation.id());
            result = handler.get().invoke(pipeline);
        } catch (RuntimeException unexpected) {
            log.warn("[PIPELINE] Step {} of {} failed unexpectedly", step, pipeline.id(), unexpected);
            result = HandlerResult.transientFailure(pipeline, FailureClassifier.describe(unexpected));
        }
        advance(operation, result);
    }

    private void onSuccess(Operation operation, Pipeline result) {
        Pipeline advanced = result.moveToNextStep(operation.currentStep(), clock.instant());
        if (!pipelineStore.saveIfCurrentExecution(advanced)) {
            log.info("[PIPELINE] Discarding result of operation {}: execution {} was superseded",
                    operation.id(), operation.executionId());
            queue.complete(operation);
            return;
        }
        if (advanced.isDocumentReady()) {
            contentStore.markReady(advanced.id());
        }
        if (!completeStep(operation)) {
            return;
        }
        if (advanced.isComplete()) {
            PIPELINE_LOG.info("[PIPELINE] Pipeline {} complete ({} step(s))",
                    advanced.id(), advanced.completedSteps().size());
            return;
        }
        enqueueNext(operation, advanced);
    }

    /**
     * Completes the operation of a step whose result is already saved. Losing the claim at this point is
     * harmless: the worker now holding the operation finds the pipeline advanced and settles it.
     *
     * @return false if another worker took over the operation
     */
    private boolean completeStep(Operation operation) {
        try {
            queue.complete(operation);
            return true;
        } catch (LockContentionAnomaly anomaly) {
            log.warn("[PIPELINE] Step {} of {} already saved, leaving operation {} to its new holder: {}",
                    operation.currentStep(), operation.contentId(), operation.id(), anomaly.getMessage());
            return false;
        }
    }

    private void enqueueNext(Operation operation, Pipeline pipeline) {
        if (pipeline.isComplete()) {
            return;
        }
        if (queue.isCancelled(operation.id())) {
            PIPELINE_LOG.info("[PIPELINE] Pipeline {} cancelled, not enqueueing step {}",
                    pipeline.id(), pipeline.currentStep().orElse(""));
            return;
        }
        queue.enqueue(Operation.forCurrentStep(pipeline, options.queueName(), clock.instant()));
    }

    private void onTransientFailure(Operation operation, Pipeline result, String reason) {
        int failures = operation.failureCount() + 1;
        pipelineStore.saveIfCurrentExecution(result.touch(clock.instant()));
        if (options.shouldPoison(failures)) {
            poison(operation, result, "Gave up after " + failures + " failed attempt(s): " + reason);
            return;
        }
        Instant notBefore = clock.instant().plus(options.retryDelayFor(failures));
        queue.requeue(operation, reason, notBefore);
        log.warn("[PIPELINE] Step {} of {} failed (attempt {}), retrying after {}: {}",
                operation.currentStep(), operation.contentId(), failures, notBefore, reason);
    }

    private void poison(Operation operation, Pipeline pipeline, String reason) {
        queue.toPoison(operation, reason);
        pipelineStore.saveIfCurrentExecution(pipeline.withFailure(reason, clock.instant()));
        PIPELINE_LOG.warn("[PIPELINE] Pipeline {} poisoned at step {}: {}",
                pipeline.id(), operation.currentStep(), reason);
    }

    private void recordFailure(Operation operation, String reason) {
        pipelineStore.find(operation.contentId())
                .filter(pipeline -> pipeline.executionId().equals(operation.executionId()))
                .ifPresent(pipeline ->
                        pipelineStore.saveIfCurrentExecution(pipeline.withFailure(reason, clock.instant())));
    }

    private void start(Pipeline pipeline) {
        pipelineStore.save(pipeline);
        queue.enqueue(Operation.forCurrentStep(pipeline, options.queueName(), clock.instant()));
        PIPELINE_LOG.info("[PIPELINE] Scheduled {} in index {} with steps {} (execution {})",
                pipeline.id(), pipeline.ownerScope(), pipeline.plannedSteps(), pipeline.executionId());
    }

    /**
     * Cancels the current execution of a document, if any, and returns the record ids it may have saved.
     */
    private List<String> supersede(String documentId, String index) {
        Optional<Pipeline> previous = pipelineStore.find(documentId);
        if (previous.isEmpty()) {
            return List.of();
        }
        int cancelled = queue.cancelAll(documentId);
        PIPELINE_LOG.info("[PIPELINE] Superseding execution {} of {} ({} operation(s) cancelled)",
                previous.get().executionId(), documentId, cancelled);
        if (!previous.get().ownerScope().equals(index)) {
            return List.of();
        }
        Set<String> recordIds = new LinkedHashSet<>(previous.get().previousExecutionRecordIds());
        recordIds.addAll(previous.get().recordIds());
        return List.copyOf(recordIds);
    }

    private PipelineStatus toStatus(Pipeline pipeline) {
        List<Operation> operations = queue.findByContent(pipeline.id()).stream()
                .filter(operation -> operation.executionId().equals(pipeline.executionId()))
                .toList();
        boolean cancelled = operations.stream().anyMatch(Operation::cancelled);
        boolean poisoned = pipeline.failureReason() != null || operations.stream().anyMatch(queue::isPoisoned);
        Optional<String> lastFailure = Optional.ofNullable(pipeline.failureReason());
        for (int index = operations.size() - 1; index >= 0 && lastFailure.isEmpty(); index--) {
            lastFailure = operations.get(index).lastFailureReason();
        }
        return new PipelineStatus(
                pipeline.id(),
                pipeline.ownerScope(),
                pipeline.executionId(),
                contentStore.isReady(pipeline.id()),
                pipeline.isComplete(),
                cancelled,
                poisoned,
                pipeline.completedSteps(),
                pipeline.remainingSteps(),
                lastFailure,
                pipeline.lastUpdatedAt());
    }

    private static void validateFiles(DocumentUpload upload) {
        if (upload.files().isEmpty()) {
            throw new InvalidPipelineException("An upload needs at least one file");
        }
        Set<String> names = new HashSet<>();
        for (UploadedFile file : upload.files()) {
            if (file.name().isBlank()) {
                throw new InvalidPipelineException("Uploaded file names must not be blank");
            }
            if (!names.add(file.name())) {
                throw new InvalidPipelineException("Duplicate file name in upload: " + file.name());
            }
        }
    }

    private static void validateTags(Map<String, String> tags) {
        for (String key : tags.keySet()) {
            if (key == null || key.isBlank() || key.startsWith(RESERVED_TAG_PREFIX)) {
                throw new InvalidPipelineException("Tag name '" + key + "' is empty or reserved");
            }
        }
    }

    private static String requireValidId(String value, String label) {
        if (value == null || !ID_PATTERN.matcher(value).matches()) {
            throw new InvalidPipelineException("Invalid " + label + " '" + value
                    + "': use letters, digits, '.', '_', '-' or '='");
        }
        return value;
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
