package com.example.revenuesync.entity;

import com.example.revenuesync.model.SyncMode;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Row holding the sync position of one deployment target.
 * The version column turns every commit into a compare-and-set.
 */
@Entity
@Table(name = "sync_state")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncStateEntity extends BaseEntity {

    @Id
    @Column(name = "target_name", nullable = false, length = 100)
    private String targetName;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", length = 20)
    private SyncMode mode;

    @Column(name = "watermark_changed_at")
    private LocalDateTime watermarkChangedAt;

    @Column(name = "watermark_key")
    private Long watermarkKey;

    @Column(name = "resume_key")
    private Long resumeKey;

    @Column(name = "pending_changed_at")
    private LocalDateTime pendingChangedAt;

    @Column(name = "pending_key")
    private Long pendingKey;

    @Column(name = "last_run_at")
    private LocalDateTime lastRunAt;

    @Version
    @Column(name = "version")
    private Long version;
}
