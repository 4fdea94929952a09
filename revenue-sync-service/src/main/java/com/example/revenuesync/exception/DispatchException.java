package com.example.revenuesync.exception;

import com.example.revenuesync.model.BatchRange;
import com.example.revenuesync.model.DispatchResult;
import com.example.revenuesync.model.RunStage;
import lombok.Getter;

/**
 * Raised by the orchestrator when a batch ends with a result the run cannot continue from:
 * a fatal response, or exhausted retries under the HALT policy.
 */
@Getter
public class DispatchException extends SyncException {

    private final transient DispatchResult result;
    private final transient BatchRange range;

    public DispatchException(DispatchResult result, BatchRange range) {
        super(result.isFatal() ? "DISPATCH_FATAL" : "DISPATCH_RETRIES_EXHAUSTED", RunStage.DISPATCH,
                "Dispatch of " + range + " ended " + result.outcome()
                        + " after " + result.attemptCount() + " attempt(s): " + result.errorDetail());
        this.result = result;
        this.range = range;
    }
}
