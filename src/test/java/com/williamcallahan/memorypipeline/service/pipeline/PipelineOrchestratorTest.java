package com.williamcallahan.memorypipeline.service.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.memorypipeline.domain.memory.MemoryRecord;
import com.williamcallahan.memorypipeline.domain.pipeline.ArtifactType;
import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;
import com.williamcallahan.memorypipeline.domain.pipeline.PipelineStatus;
import com.williamcallahan.memorypipeline.domain.queue.Operation;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingClient;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingServiceUnavailableException;
import com.williamcallahan.memorypipeline.service.embedding.LocalHashingEmbeddingClient;
import com.williamcallahan.memorypipeline.service.pipeline.handlers.PipelineSteps;
import com.williamcallahan.memorypipeline.service.queue.QueueOptions;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies end-to-end scheduling, step advancement, retries, poisoning, cancellation and deletion
 * against the real SQLite stores and queue.
 */
class PipelineOrchestratorTest {
    private static final String INDEX = "notes";

    @TempDir
    Path tempDir;

    private PipelineHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
    }

    @Test
    void smallDocumentBecomesReadyWithSinglePartition() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        String text = PipelineHarness.words(50);

        String documentId = harness.orchestrator.schedule(
                DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText(text)));

        assertEquals("doc-1", documentId);
        assertFalse(harness.orchestrator.isReady(documentId));

        assertEquals(4, harness.drain());

        assertTrue(harness.orchestrator.isReady(documentId));
        verify(harness.contentStore, times(1)).markReady(documentId);
        Pipeline pipeline = harness.pipelineStore.find(documentId).orElseThrow();
        assertEquals(PipelineSteps.DEFAULT_INGESTION, pipeline.completedSteps());
        assertEquals(1, pipeline.files().get(0).generatedFilesOfType(ArtifactType.TEXT_PARTITION).size());

        List<MemoryRecord> records = harness.memoryDb.getList(INDEX, documentId);
        assertEquals(1, records.size());
        assertEquals(text, records.get(0).text());
        assertEquals(8, records.get(0).vector().length);

        PipelineStatus status = harness.orchestrator.status(documentId).orElseThrow();
        assertTrue(status.ready());
        assertTrue(status.complete());
        assertFalse(status.poisoned());

        // Nothing left to run, so readiness is not flipped again.
        assertEquals(0, harness.drain());
        verify(harness.contentStore, times(1)).markReady(documentId);
    }

    @Test
    void throttledEmbeddingsAreRetriedThenPoisoned() throws IOException {
        EmbeddingClient throttled = mock(EmbeddingClient.class);
        when(throttled.providerName()).thenReturn("test");
        when(throttled.modelName()).thenReturn("model");
        when(throttled.dimensions()).thenReturn(8);
        when(throttled.embed(anyList())).thenThrow(new EmbeddingServiceUnavailableException("HTTP 429 Too Many Requests"));
        harness = new PipelineHarness(tempDir, QueueOptions.defaults().withMaxRetriesBeforePoison(3), throttled);

        String documentId = harness.orchestrator.schedule(
                DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText(PipelineHarness.words(50))));

        // extract and partition succeed, gen_embeddings fails its first attempt
        assertEquals(3, harness.drain());
        Operation embeddingOperation = operationFor(documentId, PipelineSteps.GEN_EMBEDDINGS);
        assertEquals(1, embeddingOperation.failureCount());
        assertFalse(harness.queue.isPoisoned(embeddingOperation));

        // Backoff holds the operation back until its retry time.
        assertEquals(0, harness.drain());

        for (int attempt = 2; attempt <= 3; attempt++) {
            harness.clock.advance(Duration.ofSeconds(30));
            assertEquals(1, harness.drain());
            embeddingOperation = operationFor(documentId, PipelineSteps.GEN_EMBEDDINGS);
            assertEquals(attempt, embeddingOperation.failureCount());
            assertFalse(harness.queue.isPoisoned(embeddingOperation));
            assertFalse(harness.orchestrator.isReady(documentId));
        }

        harness.clock.advance(Duration.ofSeconds(30));
        assertEquals(1, harness.drain());
        embeddingOperation = operationFor(documentId, PipelineSteps.GEN_EMBEDDINGS);
        assertTrue(harness.queue.isPoisoned(embeddingOperation));
        assertEquals("pipelines-poison", embeddingOperation.queueName());
        assertEquals(4, embeddingOperation.failureCount());

        harness.clock.advance(Duration.ofMinutes(5));
        assertEquals(0, harness.drain());
        assertFalse(harness.orchestrator.isReady(documentId));

        PipelineStatus status = harness.orchestrator.status(documentId).orElseThrow();
        assertTrue(status.poisoned());
        assertFalse(status.ready());
        assertEquals(List.of(PipelineSteps.EXTRACT, PipelineSteps.PARTITION), status.completedSteps());
        assertTrue(status.lastFailureReason().orElseThrow().startsWith("Gave up after 4 failed attempt(s)"));
    }

    @Test
    void retryDelayFollowsBackoffSchedule() throws IOException {
        EmbeddingClient throttled = mock(EmbeddingClient.class);
        when(throttled.providerName()).thenReturn("test");
        when(throttled.modelName()).thenReturn("model");
        when(throttled.embed(anyList())).thenThrow(new EmbeddingServiceUnavailableException("timeout"));
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), throttled);

        String documentId = harness.orchestrator.schedule(
                DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText("Some text.")));
        harness.drain();

        Operation first = operationFor(documentId, PipelineSteps.GEN_EMBEDDINGS);
        assertEquals(harness.clock.instant().plusSeconds(1), first.notBefore().orElseThrow());

        harness.clock.advance(Duration.ofSeconds(1));
        assertEquals(1, harness.drain());
        Operation second = operationFor(documentId, PipelineSteps.GEN_EMBEDDINGS);
        assertEquals(harness.clock.instant().plusSeconds(2), second.notBefore().orElseThrow());
        assertTrue(second.lastFailureReason().orElseThrow().contains("timeout"));
    }

    @Test
    void invalidUploadsAreRejectedBeforeAnythingIsStored() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        UploadedFile file = UploadedFile.ofText("hello");

        assertThrows(InvalidPipelineException.class, () -> harness.orchestrator.schedule(
                DocumentUpload.of(INDEX, "doc-1", file).withSteps(List.of("extract", "summarize"))));
        assertThrows(InvalidPipelineException.class, () -> harness.orchestrator.schedule(
                DocumentUpload.of(INDEX, "bad id!", file)));
        assertThrows(InvalidPipelineException.class, () -> harness.orchestrator.schedule(
                DocumentUpload.of("bad/index", "doc-1", file)));
        assertThrows(InvalidPipelineException.class, () -> harness.orchestrator.schedule(
                DocumentUpload.of(INDEX, "doc-1")));
        assertThrows(InvalidPipelineException.class, () -> harness.orchestrator.schedule(
                DocumentUpload.of(INDEX, "doc-1", file, UploadedFile.ofText("again"))));
        assertThrows(InvalidPipelineException.class, () -> harness.orchestrator.schedule(
                DocumentUpload.of(INDEX, "doc-1", file).withTags(Map.of("__document_id", "spoofed"))));

        assertTrue(harness.pipelineStore.find("doc-1").isEmpty());
        assertTrue(harness.queue.findByContent("doc-1").isEmpty());
        assertTrue(harness.contentStore.find("doc-1").isEmpty());
    }

    @Test
    void missingDocumentIdIsGenerated() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));

        String documentId = harness.orchestrator.schedule(
                DocumentUpload.of(null, null, UploadedFile.ofText("Generated id.")));

        assertFalse(documentId.isBlank());
        assertEquals(DocumentUpload.DEFAULT_INDEX, harness.pipelineStore.find(documentId).orElseThrow().ownerScope());
    }

    @Test
    void customStepListRunsOnlyTheChosenSteps() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));

        String documentId = harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-1",
                        UploadedFile.ofText("Only extracted."))
                .withSteps(List.of(PipelineSteps.EXTRACT)));
        harness.drain();

        assertTrue(harness.orchestrator.isReady(documentId));
        assertEquals("Only extracted.", harness.contentStore.find(documentId).orElseThrow().content());
        assertEquals(0, harness.memoryDb.size(INDEX));
    }

    @Test
    void cancelledPipelineRunsNoFurtherSteps() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        String documentId = harness.orchestrator.schedule(
                DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText("Cancel me.")));

        assertEquals(1, harness.orchestrator.cancel(documentId));

        assertEquals(0, harness.drain());
        PipelineStatus status = harness.orchestrator.status(documentId).orElseThrow();
        assertTrue(status.cancelled());
        assertFalse(status.ready());
        assertEquals(List.of(), status.completedSteps());
    }

    @Test
    void claimedOperationCancelledBeforeItStartsIsReleased() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        String documentId = harness.orchestrator.schedule(
                DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText("Cancel me later.")));
        Operation claimed = harness.queue.claim(1).get(0);

        harness.orchestrator.cancel(documentId);
        harness.orchestrator.process(claimed);

        // Cancellation is observed before the handler runs, so the claim is released untouched.
        assertEquals(1, harness.queue.findByContent(documentId).size());
        assertFalse(harness.queue.find(claimed.id()).orElseThrow().isLocked());
        assertEquals(0, harness.drain());
        assertFalse(harness.orchestrator.isReady(documentId));
    }

    @Test
    void reuploadSupersedesPreviousExecutionAndPurgesItsRecords() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-1",
                UploadedFile.of("first.txt", "First version.".getBytes(StandardCharsets.UTF_8))));
        harness.drain();
        String oldExecution = harness.pipelineStore.find("doc-1").orElseThrow().executionId();
        assertEquals(List.of("d=doc-1//p=first.txt.partition.0.txt"),
                harness.memoryDb.getList(INDEX, "doc-1").stream().map(MemoryRecord::id).toList());

        harness.clock.advance(Duration.ofSeconds(5));
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-1",
                UploadedFile.of("second.txt", "Second version.".getBytes(StandardCharsets.UTF_8))));

        assertFalse(harness.orchestrator.isReady("doc-1"));
        harness.drain();

        Pipeline pipeline = harness.pipelineStore.find("doc-1").orElseThrow();
        assertFalse(oldExecution.equals(pipeline.executionId()));
        assertTrue(pipeline.previousExecutionRecordIds().isEmpty());
        assertTrue(harness.orchestrator.isReady("doc-1"));
        List<MemoryRecord> records = harness.memoryDb.getList(INDEX, "doc-1");
        assertEquals(List.of("d=doc-1//p=second.txt.partition.0.txt"),
                records.stream().map(MemoryRecord::id).toList());
        assertEquals("Second version.", records.get(0).text());
    }

    @Test
    void operationOfSupersededExecutionIsRetiredWithoutRunning() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText("Old text.")));
        Operation stale = harness.queue.claim(1).get(0);

        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText("New text.")));
        harness.orchestrator.process(stale);

        assertTrue(harness.queue.find(stale.id()).orElseThrow().complete());
        harness.drain();
        assertTrue(harness.orchestrator.isReady("doc-1"));
        assertEquals("New text.", harness.memoryDb.getList(INDEX, "doc-1").get(0).text());
    }

    @Test
    void unsupportedFileTypeIsPoisonedWithoutRetry() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        String documentId = harness.orchestrator.schedule(DocumentUpload.of(INDEX, "image",
                new UploadedFile("photo.png", "image/png", new byte[] {1, 2, 3})));

        assertEquals(1, harness.drain());

        Operation extract = operationFor(documentId, PipelineSteps.EXTRACT);
        assertTrue(harness.queue.isPoisoned(extract));
        assertEquals(1, extract.failureCount());
        PipelineStatus status = harness.orchestrator.status(documentId).orElseThrow();
        assertTrue(status.poisoned());
        assertFalse(status.ready());
        assertTrue(status.lastFailureReason().orElseThrow().contains("image/png"));
    }

    @Test
    void deleteDocumentRemovesRecordsFilesAndContent() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText("Delete me.")));
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-2", UploadedFile.ofText("Keep me.")));
        harness.drain();

        assertEquals("doc-1", harness.orchestrator.deleteDocument(INDEX, "doc-1"));
        assertEquals(1, harness.drain());

        assertTrue(harness.memoryDb.getList(INDEX, "doc-1").isEmpty());
        assertEquals(1, harness.memoryDb.getList(INDEX, "doc-2").size());
        assertTrue(harness.contentStore.find("doc-1").isEmpty());
        assertFalse(harness.storage.exists(INDEX, "doc-1", "content.txt"));
        assertFalse(harness.orchestrator.isReady("doc-1"));
        assertTrue(harness.orchestrator.isReady("doc-2"));
        assertTrue(harness.orchestrator.status("doc-1").orElseThrow().complete());
    }

    @Test
    void deleteIndexRemovesEveryDocumentOfTheIndex() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText("One.")));
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-2", UploadedFile.ofText("Two.")));
        harness.orchestrator.schedule(DocumentUpload.of("other", "doc-3", UploadedFile.ofText("Three.")));
        harness.drain();

        String pipelineId = harness.orchestrator.deleteIndex(INDEX);
        harness.drain();

        assertEquals("delete-index-" + INDEX, pipelineId);
        assertEquals(0, harness.memoryDb.size(INDEX));
        assertEquals(1, harness.memoryDb.size("other"));
        assertTrue(harness.contentStore.findByIndex(INDEX).isEmpty());
        assertEquals(List.of(pipelineId),
                harness.pipelineStore.findByScope(INDEX).stream().map(Pipeline::id).toList());
        assertTrue(harness.orchestrator.status(pipelineId).orElseThrow().complete());
        assertTrue(harness.orchestrator.isReady("doc-3"));
    }

    @Test
    void deleteIndexCancelsPendingWork() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText("Pending.")));

        harness.orchestrator.deleteIndex(INDEX);
        harness.drain();

        assertTrue(harness.queue.findByContent("doc-1").get(0).cancelled());
        assertEquals(0, harness.memoryDb.size(INDEX));
    }

    @Test
    void stalledPipelinesAreResumedOnce() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText("Resume me.")));
        Operation claimed = harness.queue.claim(1).get(0);
        // The operation finished but the worker died before enqueueing the next step.
        harness.pipelineStore.save(harness.pipelineStore.find("doc-1").orElseThrow()
                .moveToNextStep(PipelineSteps.EXTRACT, harness.clock.instant()));
        harness.queue.complete(claimed);

        assertEquals(1, harness.orchestrator.resumeStalledPipelines());
        assertEquals(0, harness.orchestrator.resumeStalledPipelines());

        assertEquals(Operation.idFor(claimed.executionId(), 1),
                operationFor("doc-1", PipelineSteps.PARTITION).id());
    }

    @Test
    void poisonedPipelinesAreNotResumed() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "image",
                new UploadedFile("photo.png", "image/png", new byte[] {1})));
        harness.drain();

        assertEquals(0, harness.orchestrator.resumeStalledPipelines());
    }

    @Test
    void staleOperationOfAdvancedPipelineEnqueuesNextStep() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText("Advanced.")));
        Operation claimed = harness.queue.claim(1).get(0);
        harness.pipelineStore.save(harness.pipelineStore.find("doc-1").orElseThrow()
                .moveToNextStep(PipelineSteps.EXTRACT, harness.clock.instant()));

        harness.orchestrator.process(claimed);

        assertTrue(harness.queue.find(claimed.id()).orElseThrow().complete());
        assertFalse(operationFor("doc-1", PipelineSteps.PARTITION).complete());
    }

    @Test
    void crashBeforeReadinessIsWrittenIsRecoveredOnceTheLockExpires() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        doThrow(new IllegalStateException("worker died")).doCallRealMethod()
                .when(harness.contentStore).markReady("doc-1");
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText(PipelineHarness.words(20))));

        harness.drain();
        assertTrue(harness.pipelineStore.find("doc-1").orElseThrow().isComplete());
        assertFalse(harness.orchestrator.isReady("doc-1"));

        harness.clock.advance(harness.options.lockDuration().plusSeconds(1));
        assertEquals(1, harness.drain());

        assertTrue(harness.orchestrator.isReady("doc-1"));
        assertTrue(operationFor("doc-1", PipelineSteps.SAVE_RECORDS).complete());
        assertFalse(harness.orchestrator.status("doc-1").orElseThrow().poisoned());
    }

    @Test
    void resumeMarksFinishedPipelineReady() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        doThrow(new IllegalStateException("worker died")).doCallRealMethod()
                .when(harness.contentStore).markReady("doc-1");
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText(PipelineHarness.words(20))));
        harness.drain();

        assertEquals(0, harness.orchestrator.resumeStalledPipelines());

        assertTrue(harness.orchestrator.isReady("doc-1"));
    }

    @Test
    void stepThatOutlivesItsLockIsSettledByTheNewHolder() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "doc-1", UploadedFile.ofText("Slow step."))
                .withSteps(List.of(PipelineSteps.EXTRACT)));
        Operation slow = harness.queue.claim(1).get(0);
        harness.clock.advance(harness.options.lockDuration().plusSeconds(1));
        Operation reclaimed = harness.queue.claim(1).get(0);

        harness.orchestrator.process(slow);
        harness.orchestrator.process(reclaimed);

        Operation operation = harness.queue.find(slow.id()).orElseThrow();
        assertTrue(operation.complete());
        assertFalse(harness.queue.isPoisoned(operation));
        PipelineStatus status = harness.orchestrator.status("doc-1").orElseThrow();
        assertTrue(status.ready());
        assertTrue(status.complete());
        assertFalse(status.poisoned());
        assertTrue(status.lastFailureReason().isEmpty());
    }

    @Test
    void lockContentionOnFailedStepForcesOperationToPoison() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));
        harness.orchestrator.schedule(DocumentUpload.of(INDEX, "image",
                new UploadedFile("photo.png", "image/png", new byte[] {1})));
        Operation stale = harness.queue.claim(1).get(0);
        harness.clock.advance(harness.options.lockDuration().plusSeconds(1));
        assertEquals(1, harness.queue.claim(1).size());

        harness.orchestrator.process(stale);

        Operation operation = harness.queue.find(stale.id()).orElseThrow();
        assertTrue(harness.queue.isPoisoned(operation));
        PipelineStatus status = harness.orchestrator.status("image").orElseThrow();
        assertTrue(status.poisoned());
        assertTrue(status.lastFailureReason().orElseThrow().startsWith("Lock contention"));
        assertFalse(status.ready());
    }

    @Test
    void statusIsEmptyForUnknownDocument() throws IOException {
        harness = new PipelineHarness(tempDir, QueueOptions.defaults(), new LocalHashingEmbeddingClient(8));

        assertTrue(harness.orchestrator.status("missing").isEmpty());
        assertFalse(harness.orchestrator.isReady("missing"));
    }

    private Operation operationFor(String documentId, String step) {
        return harness.queue.findByContent(documentId).stream()
                .filter(operation -> operation.currentStep().equals(step))
                .reduce((first, second) -> second)
                .orElseThrow();
    }
}
