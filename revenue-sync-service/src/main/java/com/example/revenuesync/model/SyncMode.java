package com.example.revenuesync.model;

/**
 * Extraction mode of a sync run.
 */
public enum SyncMode {
    /** Scan the whole source table by primary key. */
    FULL,
    /** Only rows whose change column is past the stored watermark. */
    INCREMENTAL
}
