package com.example.revenuesync.exception;

import com.example.revenuesync.model.RunStage;

/**
 * Unexpected error inside the pipeline that no more specific exception covers.
 */
public class PipelineException extends SyncException {

    public PipelineException(RunStage stage, String message, Throwable cause) {
        super("PIPELINE_FAILED", stage, message, cause);
    }
}
