package com.example.revenuesync.model;

/**
 * What the orchestrator does with a batch whose retries are exhausted.
 */
public enum FailurePolicy {
    /** Stop the run; it ends FAILED. */
    HALT,
    /** Record the failed range and keep sending; commits stay frozen before the failed batch. */
    SKIP
}
