package com.williamcallahan.memorypipeline.service.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.memorypipeline.config.AppProperties;
import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;
import com.williamcallahan.memorypipeline.domain.queue.Operation;
import com.williamcallahan.memorypipeline.service.queue.OperationQueue;
import com.williamcallahan.memorypipeline.service.queue.QueueOptions;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies polling, synchronous draining and isolation of failures outside handlers.
 */
class PipelineWorkerTest {
    private final PipelineOrchestrator orchestrator = mock(PipelineOrchestrator.class);
    private final OperationQueue queue = mock(OperationQueue.class);
    private final AppProperties appProperties = new AppProperties();
    private PipelineWorker worker;

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.shutdown();
        }
    }

    @Test
    void disabledWorkerNeverClaims() {
        appProperties.getWorker().setEnabled(false);
        worker = new PipelineWorker(orchestrator, queue, QueueOptions.defaults(), appProperties);

        worker.poll();
        worker.resumeOnStartup();

        verify(queue, never()).claim(anyInt());
        verify(orchestrator, never()).resumeStalledPipelines();
    }

    @Test
    void pollClaimsNoMoreThanFreeThreads() {
        appProperties.getWorker().setThreads(2);
        Operation operation = operation("doc-1");
        when(queue.claim(2)).thenReturn(List.of(operation));
        worker = new PipelineWorker(orchestrator, queue, QueueOptions.defaults(), appProperties);

        worker.poll();

        verify(queue).claim(2);
        verify(orchestrator, timeout(2000)).process(operation);
    }

    @Test
    void processAvailableKeepsGoingAfterAFailure() {
        Operation failing = operation("doc-1");
        Operation healthy = operation("doc-2");
        when(queue.claim(3)).thenReturn(List.of(failing, healthy), List.of());
        doThrow(new IllegalStateException("boom")).when(orchestrator).process(failing);
        worker = new PipelineWorker(orchestrator, queue, QueueOptions.defaults(), appProperties);

        assertEquals(2, worker.processAvailable());

        verify(orchestrator).process(healthy);
    }

    @Test
    void startupResumesStalledPipelines() {
        worker = new PipelineWorker(orchestrator, queue, QueueOptions.defaults(), appProperties);

        worker.resumeOnStartup();

        verify(orchestrator).resumeStalledPipelines();
    }

    private static Operation operation(String documentId) {
        Pipeline pipeline = Pipeline.create(documentId, "kb", "exec-" + documentId, List.of("extract"), List.of(),
                Map.of(), Instant.parse("2026-01-01T00:00:00Z"));
        return Operation.forCurrentStep(pipeline, "pipelines", pipeline.createdAt());
    }
}
