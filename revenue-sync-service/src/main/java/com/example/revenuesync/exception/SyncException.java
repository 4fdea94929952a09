package com.example.revenuesync.exception;

import com.example.revenuesync.model.RunStage;
import lombok.Getter;

/**
 * Base exception for all sync engine errors.
 * Carries the pipeline stage that raised it so the run summary can report where a run failed.
 */
@Getter
public abstract class SyncException extends RuntimeException {

    private final String code;
    private final RunStage stage;

    protected SyncException(String code, RunStage stage, String message) {
        super(message);
        this.code = code;
        this.stage = stage;
    }

    protected SyncException(String code, RunStage stage, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.stage = stage;
    }
}
