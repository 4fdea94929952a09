package com.example.revenuesync.service;

import com.example.revenuesync.model.SyncState;

/**
 * Durable home of the sync watermark. The only writer of sync state.
 */
public interface SyncStateStore {

    /**
     * Current state of the configured target; {@link SyncState#initial(String)} when nothing
     * has been committed yet.
     */
    SyncState read();

    /**
     * Atomically replaces {@code expected} with {@code next}.
     *
     * @return the stored state, carrying its new version
     * @throws com.example.revenuesync.exception.StateCommitException when the stored version
     * differs from {@code expected}, when {@code next} would move the watermark or the
     * full-scan checkpoint backwards, or when the write fails
     */
    SyncState commit(SyncState expected, SyncState next);
}
