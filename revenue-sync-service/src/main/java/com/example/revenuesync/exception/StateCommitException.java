package com.example.revenuesync.exception;

import com.example.revenuesync.model.RunStage;

/**
 * The new watermark could not be persisted. Fatal: no further batch may be sent.
 */
public class StateCommitException extends SyncException {

    public StateCommitException(String message) {
        super("STATE_COMMIT_FAILED", RunStage.COMMIT, message);
    }

    public StateCommitException(String message, Throwable cause) {
        super("STATE_COMMIT_FAILED", RunStage.COMMIT, message, cause);
    }
}
