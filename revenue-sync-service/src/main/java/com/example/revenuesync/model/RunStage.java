package com.example.revenuesync.model;

/**
 * Stages of a single sync run.
 *
 * INIT -> EXTRACT -> MAP -> BATCH -> DISPATCH -> COMMIT, looping until the source
 * stream is exhausted, then DONE. FAILED is reachable from every stage.
 */
public enum RunStage {
    INIT,
    EXTRACT,
    MAP,
    BATCH,
    DISPATCH,
    COMMIT,
    DONE,
    FAILED
}
