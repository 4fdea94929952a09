package com.example.revenuesync.entity;

import com.example.revenuesync.model.RunStage;
import com.example.revenuesync.model.SyncMode;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Audit row for one sync run: status, counters, watermarks and, on failure, the stage and error.
 */
@Entity
@Table(name = "sync_runs", indexes = {
        @Index(name = "idx_sync_runs_target_status", columnList = "target_name,status"),
        @Index(name = "idx_sync_runs_started_at", columnList = "started_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncRun extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "target_name", nullable = false, length = 100)
    private String targetName;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", nullable = false, length = 20)
    private SyncMode mode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private Status status;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "records_read")
    private Long recordsRead;

    @Column(name = "records_mapped")
    private Long recordsMapped;

    @Column(name = "records_skipped")
    private Long recordsSkipped;

    @Column(name = "batches_sent")
    private Long batchesSent;

    @Column(name = "batches_failed")
    private Long batchesFailed;

    @Column(name = "start_watermark", length = 64)
    private String startWatermark;

    @Column(name = "final_watermark", length = 64)
    private String finalWatermark;

    @Enumerated(EnumType.STRING)
    @Column(name = "failed_stage", length = 20)
    private RunStage failedStage;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;

    public Long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return java.time.Duration.between(startedAt, completedAt).toMillis();
    }

    public void markAsStarted(String correlationId) {
        this.status = Status.RUNNING;
        this.startedAt = LocalDateTime.now();
        this.correlationId = correlationId;
    }

    public void markAsFinished(Status status) {
        this.status = status;
        this.completedAt = LocalDateTime.now();
    }

    /**
     * Audit status. Mirrors {@link com.example.revenuesync.model.RunStatus} plus RUNNING.
     */
    public enum Status {
        RUNNING,
        COMPLETED,
        COMPLETED_WITH_FAILURES,
        FAILED,
        CANCELLED
    }
}
