package com.example.revenuesync.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Persisted sync position of one deployment target.
 * Only {@link com.example.revenuesync.service.SyncStateStore} produces new instances that get stored.
 */
@Value
@Builder(toBuilder = true)
public class SyncState {

    String targetName;

    /** Mode of the run that last committed; null before the first commit. */
    SyncMode mode;

    /** Last acknowledged position for incremental extraction. */
    Watermark watermark;

    /** Last acknowledged key of a full scan that has not finished yet. */
    Long resumeKey;

    /** Highest position seen by the unfinished full scan. */
    Watermark pendingWatermark;

    LocalDateTime lastRunAt;

    /** Optimistic lock version; null while nothing has been stored. */
    Long version;

    public static SyncState initial(String targetName) {
        return SyncState.builder().targetName(targetName).build();
    }

    public boolean hasUnfinishedFullScan() {
        return resumeKey != null;
    }
}
