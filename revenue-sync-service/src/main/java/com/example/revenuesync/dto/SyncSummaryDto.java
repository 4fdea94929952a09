package com.example.revenuesync.dto;

import com.example.revenuesync.model.BatchRange;
import com.example.revenuesync.model.RunStage;
import com.example.revenuesync.model.RunStatus;
import com.example.revenuesync.model.SyncMode;
import com.example.revenuesync.model.Watermark;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one sync run.
 * Logged at the end of every run and persisted to the run audit row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncSummaryDto {

    private Long syncRunId;
    private String correlationId;
    private SyncMode mode;
    private boolean dryRun;
    private RunStatus status;

    private long recordsRead;
    private long recordsMapped;
    private long recordsSkipped;

    private long batchesBuilt;
    private long batchesSent;
    private long batchesFailed;
    @Builder.Default
    private List<BatchRange> failedBatches = new ArrayList<>();

    private long recordsInserted;
    private long recordsUpdated;
    private long dispatchAttempts;

    private Watermark startWatermark;
    private Watermark finalWatermark;

    private Duration elapsed;

    /** Stage that failed; null unless status is FAILED. */
    private RunStage failedStage;
    private String errorMessage;

    public int exitCode() {
        return status != null ? status.exitCode() : RunStatus.FAILED.exitCode();
    }

    public String describe() {
        return String.format(
                "status=%s mode=%s dryRun=%s read=%d mapped=%d skipped=%d batchesBuilt=%d batchesSent=%d "
                        + "batchesFailed=%d inserted=%d updated=%d startWatermark=%s finalWatermark=%s elapsed=%dms%s",
                status, mode, dryRun, recordsRead, recordsMapped, recordsSkipped, batchesBuilt, batchesSent,
                batchesFailed, recordsInserted, recordsUpdated, startWatermark, finalWatermark,
                elapsed != null ? elapsed.toMillis() : 0,
                failedBatches.isEmpty() ? "" : " failedBatches=" + failedBatches);
    }
}
