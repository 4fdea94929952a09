package com.example.revenuesync.model;

public enum DispatchOutcome {
    SUCCESS,
    RETRYABLE,
    FATAL
}
