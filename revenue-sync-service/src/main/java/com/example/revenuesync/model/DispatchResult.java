package com.example.revenuesync.model;

/**
 * Outcome of sending one batch, after the retry policy has run its course.
 *
 * @param attemptCount number of HTTP attempts made, 0 for a dry run
 * @param httpStatus   last HTTP status seen, or null when no response arrived
 */
public record DispatchResult(long batchSequence,
                             DispatchOutcome outcome,
                             int attemptCount,
                             String errorDetail,
                             Integer httpStatus,
                             int inserted,
                             int updated) {

    public static DispatchResult success(long batchSequence, int attemptCount, int httpStatus,
                                         int inserted, int updated) {
        return new DispatchResult(batchSequence, DispatchOutcome.SUCCESS, attemptCount, null,
                httpStatus, inserted, updated);
    }

    public static DispatchResult retryable(long batchSequence, int attemptCount, Integer httpStatus, String detail) {
        return new DispatchResult(batchSequence, DispatchOutcome.RETRYABLE, attemptCount, detail, httpStatus, 0, 0);
    }

    public static DispatchResult fatal(long batchSequence, int attemptCount, Integer httpStatus, String detail) {
        return new DispatchResult(batchSequence, DispatchOutcome.FATAL, attemptCount, detail, httpStatus, 0, 0);
    }

    public boolean isSuccess() {
        return outcome == DispatchOutcome.SUCCESS;
    }

    public boolean isFatal() {
        return outcome == DispatchOutcome.FATAL;
    }
}
