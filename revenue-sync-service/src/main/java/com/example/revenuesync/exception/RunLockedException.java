package com.example.revenuesync.exception;

import com.example.revenuesync.model.RunStage;

/**
 * Another run already holds the lock for this state target.
 */
public class RunLockedException extends SyncException {

    public RunLockedException(String lockName) {
        super("RUN_LOCKED", RunStage.INIT, "Another sync run holds lock '" + lockName + "'");
    }
}
