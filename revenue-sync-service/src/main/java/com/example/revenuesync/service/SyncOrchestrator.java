package com.example.revenuesync.service;

import com.example.revenuesync.client.external.BatchDispatcher;
import com.example.revenuesync.config.SyncProperties;
import com.example.revenuesync.dto.MappedRecord;
import com.example.revenuesync.dto.SyncSummaryDto;
import com.example.revenuesync.entity.SyncRun;
import com.example.revenuesync.exception.DispatchException;
import com.example.revenuesync.exception.MappingException;
import com.example.revenuesync.exception.PipelineException;
import com.example.revenuesync.exception.RunLockedException;
import com.example.revenuesync.exception.StateCommitException;
import com.example.revenuesync.exception.SyncException;
import com.example.revenuesync.metrics.SyncMetrics;
import com.example.revenuesync.model.Batch;
import com.example.revenuesync.model.BatchRange;
import com.example.revenuesync.model.DispatchResult;
import com.example.revenuesync.model.FailurePolicy;
import com.example.revenuesync.model.RunStage;
import com.example.revenuesync.model.RunStatus;
import com.example.revenuesync.model.SourceRecord;
import com.example.revenuesync.model.SyncMode;
import com.example.revenuesync.model.SyncState;
import com.example.revenuesync.model.Watermark;
import com.example.revenuesync.repository.SourceExtractor;
import com.example.revenuesync.repository.SourceRecordCursor;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one sync: extract, map, batch, dispatch, commit.
 *
 * CRITICAL DESIGN:
 * - A producer task on syncTaskExecutor extracts, maps and batches into a bounded queue
 * - The calling thread dispatches batches one at a time, in order, and commits after each SUCCESS
 * - The watermark moves only through SyncStateStore and only after an acknowledged batch
 * - Real runs hold a ShedLock lock per target; dry runs take no lock and write nothing
 * - An incremental run with no watermark yet scans by key and checkpoints like a full scan
 * - Cancellation (cancel(), timeout, shutdown) is checked between batches, so the in-flight
 *   dispatch and its commit always finish
 */
@Service
@Slf4j
public class SyncOrchestrator {

    static final String CORRELATION_ID = "correlationId";
    static final long POLL_MILLIS = 200;
    static final Duration PRODUCER_JOIN_TIMEOUT = Duration.ofSeconds(30);

    private final SyncProperties properties;
    private final SourceExtractor sourceExtractor;
    private final RecordMapper recordMapper;
    private final BatchDispatcher batchDispatcher;
    private final SyncStateStore syncStateStore;
    private final SyncRunService syncRunService;
    private final SyncMetrics syncMetrics;
    private final LockingTaskExecutor lockingTaskExecutor;
    private final TaskExecutor syncTaskExecutor;
    private final ObjectMapper objectMapper;

    private volatile RunControl activeRun;

    public SyncOrchestrator(SyncProperties properties,
                            SourceExtractor sourceExtractor,
                            RecordMapper recordMapper,
                            BatchDispatcher batchDispatcher,
                            SyncStateStore syncStateStore,
                            SyncRunService syncRunService,
                            SyncMetrics syncMetrics,
                            LockingTaskExecutor lockingTaskExecutor,
                            @Qualifier("syncTaskExecutor") TaskExecutor syncTaskExecutor,
                            ObjectMapper objectMapper) {
        this.properties = properties;
        this.sourceExtractor = sourceExtractor;
        this.recordMapper = recordMapper;
        this.batchDispatcher = batchDispatcher;
        this.syncStateStore = syncStateStore;
        this.syncRunService = syncRunService;
        this.syncMetrics = syncMetrics;
        this.lockingTaskExecutor = lockingTaskExecutor;
        this.syncTaskExecutor = syncTaskExecutor;
        this.objectMapper = objectMapper;

        if (syncTaskExecutor instanceof ThreadPoolTaskExecutor pool) {
            syncMetrics.registerThreadPoolMetrics("syncTaskExecutor", pool.getThreadPoolExecutor());
        }
    }

    public static String lockName(String targetName) {
        return "revenue-sync:" + targetName;
    }

    /**
     * Execute one run. Never throws; every outcome is reported in the summary.
     */
    public SyncSummaryDto run(SyncMode mode, boolean dryRun) {
        boolean ownsCorrelationId = MDC.get(CORRELATION_ID) == null;
        String correlationId = ownsCorrelationId
                ? "SYNC-" + UUID.randomUUID().toString().substring(0, 8)
                : MDC.get(CORRELATION_ID);
        MDC.put(CORRELATION_ID, correlationId);

        try {
            log.info("Starting {} sync: target={}, dryRun={}, correlationId={}",
                    mode, properties.getTargetName(), dryRun, correlationId);

            if (dryRun) {
                return execute(mode, true, correlationId);
            }

            String apiKey = properties.getWebhook().getApiKey();
            if (apiKey == null || apiKey.isBlank()) {
                return notStarted(mode, correlationId, RunStatus.FAILED,
                        "sync.webhook.api-key is not set; only --dry-run is possible without it");
            }
            return executeLocked(mode, correlationId);

        } finally {
            if (ownsCorrelationId) {
                MDC.remove(CORRELATION_ID);
            }
        }
    }

    /**
     * Ask the active run to stop after its in-flight batch. No-op when idle.
     */
    public void cancel() {
        RunControl control = activeRun;
        if (control != null) {
            control.cancel("cancel requested");
        }
    }

    /**
     * Gives the active run a grace period to reach a checkpoint before the context closes.
     */
    @PreDestroy
    public void shutdown() {
        RunControl control = activeRun;
        if (control == null || control.isFinished()) {
            return;
        }
        Duration grace = properties.getRun().getShutdownGracePeriod();
        log.warn("⚠️ Shutdown requested during a sync run, waiting up to {}s for the in-flight batch",
                grace.toSeconds());
        control.cancel("shutdown");
        if (!control.awaitFinished(grace)) {
            log.error("❌ Sync run did not reach a checkpoint within {}s; uncommitted batches will be resent",
                    grace.toSeconds());
        }
    }

    private SyncSummaryDto executeLocked(SyncMode mode, String correlationId) {
        String lockName = lockName(properties.getTargetName());
        LockConfiguration lockConfiguration = new LockConfiguration(
                Instant.now(), lockName, properties.getRun().getLockAtMostFor(), Duration.ZERO);

        LockingTaskExecutor.TaskWithResult<SyncSummaryDto> task = () -> execute(mode, false, correlationId);
        LockingTaskExecutor.TaskResult<SyncSummaryDto> result;
        try {
            result = lockingTaskExecutor.executeWithLock(task, lockConfiguration);
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            log.error("❌ Could not acquire run lock '{}': {}", lockName, t.getMessage(), t);
            return notStarted(mode, correlationId, RunStatus.FAILED, "Run lock unavailable: " + t.getMessage());
        }

        if (!result.wasExecuted()) {
            RunLockedException locked = new RunLockedException(lockName);
            log.warn("⚠️ {}", locked.getMessage());
            return notStarted(mode, correlationId, RunStatus.LOCKED, locked.getMessage());
        }
        return result.getResult();
    }

    private SyncSummaryDto notStarted(SyncMode mode, String correlationId, RunStatus status, String message) {
        SyncSummaryDto summary = SyncSummaryDto.builder()
                .correlationId(correlationId)
                .mode(mode)
                .status(status)
                .failedStage(RunStage.INIT)
                .errorMessage(message)
                .elapsed(Duration.ZERO)
                .build();
        syncMetrics.recordRunFinished(status, Duration.ZERO);
        log.info("Sync summary: {}", summary.describe());
        return summary;
    }

    private SyncSummaryDto execute(SyncMode mode, boolean dryRun, String correlationId) {
        long startNanos = System.nanoTime();
        RunControl control = new RunControl();
        activeRun = control;

        SyncSummaryDto summary = SyncSummaryDto.builder()
                .correlationId(correlationId)
                .mode(mode)
                .dryRun(dryRun)
                .build();
        RunContext context = new RunContext(mode, dryRun, control);
        SyncRun syncRun = null;

        try {
            SyncState state = syncStateStore.read();
            context.committed = state;
            context.scan = scanFor(mode, state);
            summary.setStartWatermark(state.getWatermark());

            if (!dryRun) {
                syncRun = syncRunService.startRun(mode, correlationId, state.getWatermark());
                summary.setSyncRunId(syncRun.getId());
            }

            RunStatus status = runPipeline(context, summary);
            summary.setStatus(status);

        } catch (SyncException e) {
            fail(summary, e.getStage(), e);
        } catch (RuntimeException e) {
            fail(summary, context.stage, e);
        } finally {
            context.copyCountersTo(summary);
            summary.setFinalWatermark(context.committed != null
                    ? context.committed.getWatermark()
                    : summary.getStartWatermark());
            summary.setElapsed(Duration.ofNanos(System.nanoTime() - startNanos));

            finishAudit(syncRun, summary);
            syncMetrics.recordRunFinished(summary.getStatus(), summary.getElapsed());
            control.markFinished();
            activeRun = null;
        }

        if (summary.getStatus() == RunStatus.FAILED) {
            log.error("❌ Sync run FAILED at {}: {}", summary.getFailedStage(), summary.describe());
        } else {
            log.info("✅ Sync summary: {}", summary.describe());
        }
        return summary;
    }

    private RunStatus runPipeline(RunContext context, SyncSummaryDto summary) {
        BlockingQueue<Envelope> queue = new ArrayBlockingQueue<>(properties.getRun().getQueueCapacity());
        AtomicBoolean stopProducer = new AtomicBoolean();
        CountDownLatch producerDone = new CountDownLatch(1);

        context.stage = RunStage.EXTRACT;
        try {
            syncTaskExecutor.execute(() -> produce(context, queue, stopProducer, producerDone));
        } catch (RejectedExecutionException e) {
            throw new PipelineException(RunStage.INIT, "Producer task rejected: " + e.getMessage(), e);
        }

        try {
            return consume(context, summary, queue, producerDone);
        } finally {
            stopProducer.set(true);
            queue.clear();
            awaitProducer(producerDone);
        }
    }

    private RunStatus consume(RunContext context, SyncSummaryDto summary,
                              BlockingQueue<Envelope> queue, CountDownLatch producerDone) {
        Duration timeout = properties.getRun().getTimeout();
        long deadline = timeout != null ? System.nanoTime() + timeout.toNanos() : Long.MAX_VALUE;
        FailurePolicy policy = properties.getRun().getFailurePolicy();
        boolean commitsFrozen = false;

        while (true) {
            if (System.nanoTime() - deadline > 0) {
                context.control.cancel("timeout after " + timeout.toSeconds() + "s");
            }
            if (context.control.isCancelled()) {
                log.warn("⚠️ Sync run cancelled ({}); stopping before the next batch", context.control.reason());
                summary.setErrorMessage("Cancelled: " + context.control.reason());
                return RunStatus.CANCELLED;
            }

            Envelope envelope = take(queue);
            if (envelope == null) {
                if (producerDone.getCount() > 0) {
                    continue;
                }
                // the producer may have published its last item just before finishing
                envelope = queue.poll();
                if (envelope == null) {
                    throw new PipelineException(RunStage.EXTRACT,
                            "Producer stopped without publishing the end of the stream", null);
                }
            }
            if (envelope.failure() != null) {
                throw envelope.failure();
            }
            if (envelope == Envelope.END) {
                if (context.scan == SyncMode.FULL && !context.dryRun && !commitsFrozen) {
                    finishFullScan(context);
                }
                return commitsFrozen ? RunStatus.COMPLETED_WITH_FAILURES : RunStatus.COMPLETED;
            }

            Batch batch = envelope.batch();
            if (context.dryRun) {
                log.info("Dry run: would send {}", batch.range());
                continue;
            }

            context.stage = RunStage.DISPATCH;
            DispatchResult result = batchDispatcher.dispatch(batch);
            context.dispatchAttempts += result.attemptCount();

            if (result.isSuccess()) {
                context.batchesSent++;
                context.recordsInserted += result.inserted();
                context.recordsUpdated += result.updated();
                if (!commitsFrozen) {
                    context.stage = RunStage.COMMIT;
                    commitBatch(context, batch);
                }
                continue;
            }

            BatchRange range = batch.range();
            context.batchesFailed++;
            summary.getFailedBatches().add(range);

            if (result.isFatal() || policy == FailurePolicy.HALT) {
                throw new DispatchException(result, range);
            }
            if (!commitsFrozen) {
                log.warn("⚠️ Skipping {} after retries ran out; watermark stays at {} until it is resent",
                        range, context.committed.getWatermark());
            } else {
                log.warn("⚠️ Skipping {} after retries ran out", range);
            }
            commitsFrozen = true;
        }
    }

    private Envelope take(BlockingQueue<Envelope> queue) {
        try {
            return queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(RunStage.DISPATCH, "Interrupted while waiting for the next batch", e);
        }
    }

    private void commitBatch(RunContext context, Batch batch) {
        SyncState current = context.committed;
        SyncState.SyncStateBuilder next = current.toBuilder()
                .mode(context.mode)
                .lastRunAt(LocalDateTime.now());

        if (context.scan == SyncMode.INCREMENTAL) {
            next.watermark(batch.lastPosition());
        } else {
            next.resumeKey(batch.lastPosition().key())
                    .pendingWatermark(Watermark.max(
                            current.getPendingWatermark(), batch.maxPosition()));
        }
        context.committed = commit(current, next.build());
        log.debug("Committed {}: watermark={}, resumeKey={}",
                batch.range(), context.committed.getWatermark(), context.committed.getResumeKey());
    }

    /**
     * Promote the full scan's highest position to the watermark and drop the checkpoint.
     */
    private void finishFullScan(RunContext context) {
        SyncState current = context.committed;
        if (current.getResumeKey() == null && current.getPendingWatermark() == null) {
            return;
        }
        context.stage = RunStage.COMMIT;
        SyncState next = current.toBuilder()
                .mode(context.mode)
                .watermark(Watermark.max(
                        current.getWatermark(), current.getPendingWatermark()))
                .resumeKey(null)
                .pendingWatermark(null)
                .build();
        context.committed = commit(current, next);
        log.info("Full scan finished; watermark advanced to {}", context.committed.getWatermark());
    }

    private SyncState commit(SyncState expected, SyncState next) {
        try {
            return syncStateStore.commit(expected, next);
        } catch (StateCommitException e) {
            syncMetrics.recordCommitFailure();
            throw e;
        } catch (RuntimeException e) {
            syncMetrics.recordCommitFailure();
            throw new StateCommitException("State commit failed: " + e.getMessage(), e);
        }
    }

    private void produce(RunContext context, BlockingQueue<Envelope> queue,
                         AtomicBoolean stop, CountDownLatch done) {
        RunStage stage = RunStage.EXTRACT;
        try (SourceRecordCursor cursor = openCursor(context)) {
            Batcher batcher = Batcher.forRun(properties.getBatch(), objectMapper);

            while (!stop.get()) {
                stage = RunStage.EXTRACT;
                if (!cursor.hasNext()) {
                    break;
                }
                SourceRecord record = cursor.next();
                context.recordsRead.incrementAndGet();
                syncMetrics.recordRecordRead();

                stage = RunStage.MAP;
                MappedRecord mapped;
                try {
                    mapped = recordMapper.map(record);
                } catch (MappingException e) {
                    context.recordsSkipped.incrementAndGet();
                    syncMetrics.recordRecordSkipped();
                    log.warn("⚠️ {}", e.getMessage());
                    continue;
                }
                context.recordsMapped.incrementAndGet();
                syncMetrics.recordRecordMapped();

                stage = RunStage.BATCH;
                if (!publishAll(batcher.add(mapped, record.position()), context, queue, stop)) {
                    return;
                }
            }

            if (!stop.get()) {
                stage = RunStage.BATCH;
                if (publishAll(batcher.flush(), context, queue, stop)) {
                    publish(Envelope.END, queue, stop);
                    log.debug("Producer finished: read={}, batches={}", cursor.rowsRead(), batcher.batchCount());
                }
            }
        } catch (SyncException e) {
            publish(Envelope.failed(e), queue, stop);
        } catch (RuntimeException e) {
            publish(Envelope.failed(new PipelineException(stage, stage + " failed: " + e.getMessage(), e)),
                    queue, stop);
        } catch (Throwable t) {
            log.error("❌ Producer died at stage {}: {}", stage, t.toString(), t);
            publish(Envelope.failed(new PipelineException(stage, stage + " failed: " + t, t)), queue, stop);
        } finally {
            done.countDown();
        }
    }

    private SourceRecordCursor openCursor(RunContext context) {
        SyncState committed = context.committed;
        if (context.scan == SyncMode.INCREMENTAL) {
            return sourceExtractor.openIncremental(committed.getWatermark());
        }
        if (committed.hasUnfinishedFullScan()) {
            log.info("Resuming unfinished full scan after TJ{}", committed.getResumeKey());
        }
        return sourceExtractor.openFullScan(committed.getResumeKey());
    }

    /**
     * Key-ordered scan for full runs and for incremental runs that have no watermark yet.
     * Paging by change position cannot use an index, so it is kept to the rows after a watermark.
     */
    static SyncMode scanFor(SyncMode mode, SyncState state) {
        if (mode == SyncMode.INCREMENTAL && state.getWatermark() == null) {
            log.info("No committed watermark for '{}'; walking the table in key order with checkpoints",
                    state.getTargetName());
            return SyncMode.FULL;
        }
        return mode;
    }

    private boolean publishAll(List<Batch> batches, RunContext context,
                               BlockingQueue<Envelope> queue, AtomicBoolean stop) {
        for (Batch batch : batches) {
            context.batchesBuilt.incrementAndGet();
            if (!publish(Envelope.of(batch), queue, stop)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Blocks while the queue is full; gives up once the consumer has stopped.
     */
    private boolean publish(Envelope envelope, BlockingQueue<Envelope> queue, AtomicBoolean stop) {
        try {
            while (!stop.get()) {
                if (queue.offer(envelope, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private void awaitProducer(CountDownLatch producerDone) {
        try {
            if (!producerDone.await(PRODUCER_JOIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("⚠️ Producer still running {}s after the run stopped", PRODUCER_JOIN_TIMEOUT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void fail(SyncSummaryDto summary, RunStage stage, RuntimeException e) {
        summary.setStatus(RunStatus.FAILED);
        summary.setFailedStage(stage);
        summary.setErrorMessage(e.getMessage());
        if (e instanceof SyncException) {
            log.error("❌ {} at stage {}: {}", ((SyncException) e).getCode(), stage, e.getMessage());
        } else {
            log.error("❌ Unexpected error at stage {}: {}", stage, e.getMessage(), e);
        }
    }

    private void finishAudit(SyncRun syncRun, SyncSummaryDto summary) {
        if (syncRun == null) {
            return;
        }
        try {
            syncRunService.finishRun(syncRun.getId(), summary);
        } catch (RuntimeException e) {
            log.error("Failed to write audit row for sync run id={}: {}", syncRun.getId(), e.getMessage(), e);
        }
    }

    /**
     * Item passed from the producer to the dispatching thread: a batch, a failure, or END.
     */
    private record Envelope(Batch batch, RuntimeException failure) {

        static final Envelope END = new Envelope(null, null);

        static Envelope of(Batch batch) {
            return new Envelope(batch, null);
        }

        static Envelope failed(RuntimeException failure) {
            return new Envelope(null, failure);
        }
    }

    /**
     * Mutable state of one run. Producer-side counters are atomic; the rest is confined to
     * the dispatching thread.
     */
    private static final class RunContext {

        private final SyncMode mode;
        private final boolean dryRun;
        private final RunControl control;

        private final AtomicLong recordsRead = new AtomicLong();
        private final AtomicLong recordsMapped = new AtomicLong();
        private final AtomicLong recordsSkipped = new AtomicLong();
        private final AtomicLong batchesBuilt = new AtomicLong();

        private volatile RunStage stage = RunStage.INIT;
        private volatile SyncState committed;
        private volatile SyncMode scan;
        private long batchesSent;
        private long batchesFailed;
        private long recordsInserted;
        private long recordsUpdated;
        private long dispatchAttempts;

        private RunContext(SyncMode mode, boolean dryRun, RunControl control) {
            this.mode = mode;
            this.dryRun = dryRun;
            this.control = control;
        }

        private void copyCountersTo(SyncSummaryDto summary) {
            summary.setRecordsRead(recordsRead.get());
            summary.setRecordsMapped(recordsMapped.get());
            summary.setRecordsSkipped(recordsSkipped.get());
            summary.setBatchesBuilt(batchesBuilt.get());
            summary.setBatchesSent(batchesSent);
            summary.setBatchesFailed(batchesFailed);
            summary.setRecordsInserted(recordsInserted);
            summary.setRecordsUpdated(recordsUpdated);
            summary.setDispatchAttempts(dispatchAttempts);
        }
    }

    /**
     * Cancellation flag shared with {@link #cancel()} and {@link #shutdown()}.
     */
    private static final class RunControl {

        private final AtomicBoolean cancelled = new AtomicBoolean();
        private final CountDownLatch finished = new CountDownLatch(1);
        private volatile String reason;

        void cancel(String why) {
            if (cancelled.compareAndSet(false, true)) {
                reason = why;
                log.warn("⚠️ Cancelling sync run: {}", why);
            }
        }

        boolean isCancelled() {
            return cancelled.get();
        }

        String reason() {
            return reason;
        }

        void markFinished() {
            finished.countDown();
        }

        boolean isFinished() {
            return finished.getCount() == 0;
        }

        boolean awaitFinished(Duration timeout) {
            try {
                return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
