package com.williamcallahan.memorypipeline.service.pipeline;

import com.williamcallahan.memorypipeline.config.AppProperties;
import com.williamcallahan.memorypipeline.domain.queue.Operation;
import com.williamcallahan.memorypipeline.service.queue.OperationQueue;
import com.williamcallahan.memorypipeline.service.queue.QueueOptions;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls the operation queue and hands claimed operations to the orchestrator.
 *
 * <p>At most {@code app.worker.threads} operations run at once; the poll claims only as many operations
 * as there are free threads so nothing sits locked in memory waiting for a thread.
 */
@Component
public class PipelineWorker {
    private static final Logger log = LoggerFactory.getLogger(PipelineWorker.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    private final PipelineOrchestrator orchestrator;
    private final OperationQueue queue;
    private final QueueOptions options;
    private final boolean enabled;
    private final Semaphore permits;
    private final ExecutorService executor;

    public PipelineWorker(
            PipelineOrchestrator orchestrator, OperationQueue queue, QueueOptions options, AppProperties appProperties) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.options = Objects.requireNonNull(options, "options");
        AppProperties.Worker settings = appProperties.getWorker();
        this.enabled = settings.isEnabled();
        this.permits = new Semaphore(settings.getThreads());
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(settings.getThreads(), runnable -> {
            Thread thread = new Thread(runnable, "pipeline-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Re-creates operations lost by a crash between persisting a pipeline and enqueueing its next step.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void resumeOnStartup() {
        if (!enabled) {
            return;
        }
        int resumed = orchestrator.resumeStalledPipelines();
        if (resumed > 0) {
            log.info("[PIPELINE] Resumed {} stalled pipeline(s)", resumed);
        }
    }

    @Scheduled(fixedDelayString = "${app.queue.poll-delay-ms:100}")
    public void poll() {
        if (!enabled || executor.isShutdown()) {
            return;
        }
        int available = permits.availablePermits();
        if (available == 0) {
            return;
        }
        List<Operation> claimed = queue.claim(Math.min(options.fetchBatchSize(), available));
        for (Operation operation : claimed) {
            permits.acquireUninterruptibly();
            executor.execute(() -> {
                try {
                    runSafely(operation);
                } finally {
                    permits.release();
                }
            });
        }
    }

    /**
     * Claims and processes operations on the calling thread until the queue has nothing claimable.
     *
     * @return number of operations processed
     */
    public int processAvailable() {
        int processed = 0;
        List<Operation> claimed = queue.claim(options.fetchBatchSize());
        while (!claimed.isEmpty()) {
            for (Operation operation : claimed) {
                runSafely(operation);
                processed++;
            }
            claimed = queue.claim(options.fetchBatchSize());
        }
        return processed;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[PIPELINE] Workers still running after {}s; their locks expire on their own",
                        SHUTDOWN_WAIT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void runSafely(Operation operation) {
        try {
            orchestrator.process(operation);
        } catch (RuntimeException failure) {
            // The operation stays locked and is retried once its lock expires.
            log.error("[PIPELINE] Operation {} ({}) failed outside its handler",
                    operation.id(), operation.currentStep(), failure);
        }
    }
}
