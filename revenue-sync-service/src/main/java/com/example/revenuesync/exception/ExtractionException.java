package com.example.revenuesync.exception;

import com.example.revenuesync.model.RunStage;

/**
 * Source unreachable or query invalid. Fatal for the run.
 */
public class ExtractionException extends SyncException {

    public ExtractionException(String message, Throwable cause) {
        super("EXTRACTION_FAILED", RunStage.EXTRACT, message, cause);
    }
}
