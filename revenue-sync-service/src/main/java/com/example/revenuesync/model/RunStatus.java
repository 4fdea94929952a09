package com.example.revenuesync.model;

/**
 * Terminal outcome of a run and the process exit code it maps to.
 */
public enum RunStatus {
    COMPLETED(0),
    /** Finished, but at least one batch was skipped after exhausting retries. */
    COMPLETED_WITH_FAILURES(0),
    FAILED(1),
    CANCELLED(2),
    /** Another run holds the lock for the same state target. */
    LOCKED(3);

    private final int exitCode;

    RunStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }

    public boolean isSuccessful() {
        return exitCode == 0;
    }
}
