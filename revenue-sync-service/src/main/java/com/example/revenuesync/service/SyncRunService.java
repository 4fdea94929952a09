package com.example.revenuesync.service;

import com.example.revenuesync.config.SyncProperties;
import com.example.revenuesync.dto.SyncSummaryDto;
import com.example.revenuesync.entity.SyncRun;
import com.example.revenuesync.model.RunStatus;
import com.example.revenuesync.model.SyncMode;
import com.example.revenuesync.model.Watermark;
import com.example.revenuesync.repository.SyncRunRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Writes the run audit trail.
 *
 * Transactions here are short and never wrap a webhook call. Called only while the run
 * lock is held, so a RUNNING row found at start belongs to a process that died.
 */
@Service
@Slf4j
public class SyncRunService {

    static final int MAX_ERROR_LENGTH = 4000;

    private final SyncRunRepository syncRunRepository;
    private final String targetName;

    public SyncRunService(SyncRunRepository syncRunRepository, SyncProperties properties) {
        this.syncRunRepository = syncRunRepository;
        this.targetName = properties.getTargetName();
    }

    /**
     * Closes runs left RUNNING by a crashed process, then opens a new audit row.
     */
    @Transactional
    public SyncRun startRun(SyncMode mode, String correlationId, Watermark startWatermark) {
        List<SyncRun> abandoned = syncRunRepository.findByTargetNameAndStatusOrderByStartedAtAsc(
                targetName, SyncRun.Status.RUNNING);
        for (SyncRun run : abandoned) {
            run.markAsFinished(SyncRun.Status.FAILED);
            run.setErrorMessage("Abandoned: process ended before the run finished");
            log.warn("⚠️ Marked abandoned sync run id={} (started {}, correlationId={}) as FAILED",
                    run.getId(), run.getStartedAt(), run.getCorrelationId());
        }
        syncRunRepository.saveAll(abandoned);

        SyncRun run = SyncRun.builder()
                .targetName(targetName)
                .mode(mode)
                .startWatermark(startWatermark != null ? startWatermark.toString() : null)
                .build();
        run.markAsStarted(correlationId);

        SyncRun saved = syncRunRepository.save(run);
        log.debug("Created sync run id={} target={} mode={}", saved.getId(), targetName, mode);
        return saved;
    }

    @Transactional
    public void finishRun(Long syncRunId, SyncSummaryDto summary) {
        SyncRun run = syncRunRepository.findById(syncRunId)
                .orElseThrow(() -> new IllegalArgumentException("SyncRun not found: " + syncRunId));

        run.setRecordsRead(summary.getRecordsRead());
        run.setRecordsMapped(summary.getRecordsMapped());
        run.setRecordsSkipped(summary.getRecordsSkipped());
        run.setBatchesSent(summary.getBatchesSent());
        run.setBatchesFailed(summary.getBatchesFailed());
        run.setFinalWatermark(summary.getFinalWatermark() != null ? summary.getFinalWatermark().toString() : null);
        run.setFailedStage(summary.getFailedStage());
        run.setErrorMessage(truncate(summary.getErrorMessage()));
        run.markAsFinished(toAuditStatus(summary.getStatus()));

        syncRunRepository.save(run);
        log.info("Sync run id={} finished: status={}, read={}, sent={}, failed={}, duration={}ms",
                syncRunId, run.getStatus(), run.getRecordsRead(), run.getBatchesSent(), run.getBatchesFailed(),
                run.getDurationMs());
    }

    static SyncRun.Status toAuditStatus(RunStatus status) {
        if (status == null) {
            return SyncRun.Status.FAILED;
        }
        return switch (status) {
            case COMPLETED -> SyncRun.Status.COMPLETED;
            case COMPLETED_WITH_FAILURES -> SyncRun.Status.COMPLETED_WITH_FAILURES;
            case CANCELLED -> SyncRun.Status.CANCELLED;
            case FAILED, LOCKED -> SyncRun.Status.FAILED;
        };
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
