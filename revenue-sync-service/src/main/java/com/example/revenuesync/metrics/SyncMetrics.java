package com.example.revenuesync.metrics;

import com.example.revenuesync.model.DispatchOutcome;
import com.example.revenuesync.model.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Micrometer meters for the sync engine.
 *
 * Exposes:
 * - sync_runs_total: runs by terminal status
 * - sync_run_duration_seconds: wall time of a run
 * - sync_records_total: source records by result (read, mapped, skipped)
 * - sync_batches_total: batches by dispatch outcome
 * - sync_dispatch_attempts_total: HTTP attempts, retries included
 * - sync_dispatch_duration_seconds: time to settle one batch, retries included
 * - sync_commit_failures_total: state commits that were rejected or failed
 */
@Component
@Slf4j
public class SyncMetrics {

    private final MeterRegistry meterRegistry;

    private final Map<RunStatus, Counter> runCounters = new EnumMap<>(RunStatus.class);
    private final Map<DispatchOutcome, Counter> batchCounters = new EnumMap<>(DispatchOutcome.class);

    private final Counter recordsReadCounter;
    private final Counter recordsMappedCounter;
    private final Counter recordsSkippedCounter;
    private final Counter dispatchAttemptsCounter;
    private final Counter commitFailureCounter;

    private final Timer runTimer;
    private final Timer dispatchTimer;

    public SyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        for (RunStatus status : RunStatus.values()) {
            runCounters.put(status, Counter.builder("sync_runs_total")
                    .description("Sync runs by terminal status")
                    .tag("status", status.name().toLowerCase())
                    .register(meterRegistry));
        }

        for (DispatchOutcome outcome : DispatchOutcome.values()) {
            batchCounters.put(outcome, Counter.builder("sync_batches_total")
                    .description("Dispatched batches by final outcome")
                    .tag("outcome", outcome.name().toLowerCase())
                    .register(meterRegistry));
        }

        this.recordsReadCounter = Counter.builder("sync_records_total")
                .description("Source records by processing result")
                .tag("result", "read")
                .register(meterRegistry);

        this.recordsMappedCounter = Counter.builder("sync_records_total")
                .tag("result", "mapped")
                .register(meterRegistry);

        this.recordsSkippedCounter = Counter.builder("sync_records_total")
                .tag("result", "skipped")
                .register(meterRegistry);

        this.dispatchAttemptsCounter = Counter.builder("sync_dispatch_attempts_total")
                .description("Webhook HTTP attempts including retries")
                .register(meterRegistry);

        this.commitFailureCounter = Counter.builder("sync_commit_failures_total")
                .description("State commits rejected by the store or failed to persist")
                .register(meterRegistry);

        this.runTimer = Timer.builder("sync_run_duration_seconds")
                .description("Duration of sync runs")
                .register(meterRegistry);

        this.dispatchTimer = Timer.builder("sync_dispatch_duration_seconds")
                .description("Time to settle one batch, retries included")
                .register(meterRegistry);
    }

    public void recordRunFinished(RunStatus status, Duration elapsed) {
        if (status == null) {
            status = RunStatus.FAILED;
        }
        runCounters.get(status).increment();
        if (elapsed != null) {
            runTimer.record(elapsed);
        }
        if (status == RunStatus.FAILED) {
            log.warn("⚠️ Recorded failed sync run after {}ms", elapsed != null ? elapsed.toMillis() : 0);
        } else {
            log.debug("Recorded sync run: status={}", status);
        }
    }

    public void recordRecordRead() {
        recordsReadCounter.increment();
    }

    public void recordRecordMapped() {
        recordsMappedCounter.increment();
    }

    /**
     * Record rejected by the mapper. The log line with the record key is written at the call site.
     */
    public void recordRecordSkipped() {
        recordsSkippedCounter.increment();
    }

    public void recordDispatchAttempt() {
        dispatchAttemptsCounter.increment();
    }

    public void recordBatchDispatched(DispatchOutcome outcome, Duration elapsed) {
        batchCounters.get(outcome).increment();
        dispatchTimer.record(elapsed);
    }

    public void recordCommitFailure() {
        commitFailureCounter.increment();
        log.error("❌ State commit failed; the run stops dispatching");
    }

    /**
     * Register pool gauges for the producer executor.
     */
    public void registerThreadPoolMetrics(String executorName, ThreadPoolExecutor executor) {
        Gauge.builder("thread_pool_active", executor, ThreadPoolExecutor::getActiveCount)
                .tag("executor", executorName)
                .description("Active thread count")
                .register(meterRegistry);

        Gauge.builder("thread_pool_completed_tasks", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .tag("executor", executorName)
                .description("Completed task count")
                .register(meterRegistry);
    }
}
