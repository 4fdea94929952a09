package com.example.revenuesync.client.external;

import com.example.revenuesync.model.Batch;
import com.example.revenuesync.model.DispatchResult;

/**
 * Delivers one batch to the destination.
 */
@FunctionalInterface
public interface BatchDispatcher {

    /**
     * Blocks until the batch is settled, retries included. Never throws for delivery
     * failures; those come back as a RETRYABLE or FATAL result.
     */
    DispatchResult dispatch(Batch batch);
}
